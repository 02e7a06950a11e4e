package com.docverify.client;

import com.docverify.exception.MalformedExtractionResponseException;
import com.docverify.model.ExtractionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the collaborator's verdict. Model output is not always clean JSON, so the parser
 * accepts, in order: the whole text, the content of a ``` fenced block, or the outermost
 * {...} span. Extracted values are flattened to strings.
 */
@Component
public class ExtractionResponseParser {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");
    private static final Pattern OBJECT_SPAN = Pattern.compile("\\{[\\s\\S]*\\}");

    private final ObjectMapper objectMapper;

    public ExtractionResponseParser() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ExtractionOutcome parse(String text) {
        if (text == null || text.isBlank()) {
            throw new MalformedExtractionResponseException("Empty AI response");
        }

        ObjectNode root = locateJson(text)
                .orElseThrow(() -> new MalformedExtractionResponseException("Failed to parse AI response as JSON"));
        normalizeExtractedData(root);

        ExtractionResult result;
        try {
            result = objectMapper.treeToValue(root, ExtractionResult.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedExtractionResponseException(
                    "AI response has an unexpected structure: " + e.getMessage(), e);
        }
        applyDefaults(result);
        return new ExtractionOutcome(result, root.toString());
    }

    private Optional<ObjectNode> locateJson(String text) {
        Optional<ObjectNode> direct = readObject(text.trim());
        if (direct.isPresent()) return direct;

        Matcher fenced = FENCED_BLOCK.matcher(text);
        if (fenced.find()) {
            return readObject(fenced.group(1).trim());
        }

        Matcher span = OBJECT_SPAN.matcher(text);
        if (span.find()) {
            return readObject(span.group());
        }
        return Optional.empty();
    }

    private Optional<ObjectNode> readObject(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            if (node instanceof ObjectNode) {
                return Optional.of((ObjectNode) node);
            }
            return Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    // Values may come back as numbers, booleans or nested objects; the pipeline works on strings.
    private void normalizeExtractedData(ObjectNode root) {
        JsonNode data = root.get("extracted_data");
        if (data == null || data.isNull()) {
            root.remove("extracted_data");
            return;
        }
        if (!data.isObject()) {
            throw new MalformedExtractionResponseException("AI response field 'extracted_data' is not an object");
        }

        Map<String, String> flattened = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value == null || value.isNull()) continue;
            flattened.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
        }
        root.set("extracted_data", objectMapper.valueToTree(flattened));
    }

    private static void applyDefaults(ExtractionResult result) {
        if (result.getStatus() == null || result.getStatus().isBlank()) result.setStatus("verified");
        if (result.getExtractedData() == null) result.setExtractedData(new LinkedHashMap<>());
        if (result.getIssues() == null) result.setIssues(new ArrayList<>());
        if (result.getFraudIndicators() == null) result.setFraudIndicators(new ArrayList<>());
        if (result.getMetadataMatch() == null) result.setMetadataMatch(new LinkedHashMap<>());
    }
}
