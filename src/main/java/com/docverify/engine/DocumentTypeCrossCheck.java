package com.docverify.engine;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Keyword cross-check for document types that the extraction collaborator tends to confuse.
 * Runs even when the collaborator reported a type match, using the extracted values and its remarks.
 */
@Component
public class DocumentTypeCrossCheck {

    private static final String SSC = "10th Class Marksheet (SSC / Secondary School)";
    private static final String HSC = "12th Class Marksheet (HSC / Higher Secondary)";

    public record TypeMismatch(String expected, String detected, String reason) {}

    private record ConfusionRule(String expected, String detectedIfRejected, List<String> rejectKeywords,
                                 List<Pattern> rejectPatterns, List<String> overrideKeywords) {}

    private static final Map<String, ConfusionRule> CONFUSION_RULES = Map.of(
            "marksheet_10", new ConfusionRule(SSC, HSC,
                    List.of("higher secondary", "hsc", "senior secondary", "class xii", "class-xii",
                            "12th", "xiith", "intermediate", "plus two", "higher sec"),
                    List.of(),
                    List.of()),
            "marksheet_12", new ConfusionRule(HSC, SSC,
                    List.of("sslc", "matriculation exam"),
                    List.of(Pattern.compile("\\bsecondary\\s+school\\s+certificate\\b", Pattern.CASE_INSENSITIVE),
                            Pattern.compile("\\bssc\\s+exam", Pattern.CASE_INSENSITIVE),
                            Pattern.compile("\\bclass\\s+x\\b(?!\\s*i)", Pattern.CASE_INSENSITIVE),
                            Pattern.compile("\\b10th\\s+(class|standard|std)", Pattern.CASE_INSENSITIVE)),
                    List.of("higher secondary", "hsc", "senior secondary")));

    public Optional<TypeMismatch> check(String documentType, Map<String, String> extractedData, String remarks) {
        ConfusionRule rule = CONFUSION_RULES.get(documentType);
        if (rule == null) return Optional.empty();

        String text = buildSearchText(extractedData, remarks);
        if (text.isEmpty()) return Optional.empty();
        String lower = text.toLowerCase(Locale.ROOT);

        for (String keyword : rule.rejectKeywords()) {
            if (lower.contains(keyword)) {
                return Optional.of(new TypeMismatch(rule.expected(), rule.detectedIfRejected(),
                        String.format("Wrong document submitted: Found \"%s\" in document text which indicates this is a %s, not a %s",
                                keyword, rule.detectedIfRejected(), rule.expected())));
            }
        }

        boolean overridden = rule.overrideKeywords().stream().anyMatch(lower::contains);
        if (!overridden) {
            for (Pattern pattern : rule.rejectPatterns()) {
                if (pattern.matcher(text).find()) {
                    return Optional.of(new TypeMismatch(rule.expected(), rule.detectedIfRejected(),
                            String.format("Wrong document submitted: Document content indicates this is a %s, not a %s",
                                    rule.detectedIfRejected(), rule.expected())));
                }
            }
        }

        return checkExamClass(documentType, extractedData, rule);
    }

    private Optional<TypeMismatch> checkExamClass(String documentType, Map<String, String> extractedData, ConfusionRule rule) {
        String raw = extractedData != null ? extractedData.get("exam_class") : null;
        if (raw == null || raw.isEmpty()) return Optional.empty();
        String examClass = raw.toLowerCase(Locale.ROOT).trim();

        if ("marksheet_10".equals(documentType)
                && (examClass.contains("12") || examClass.contains("xii") || examClass.contains("higher"))) {
            return Optional.of(new TypeMismatch(rule.expected(), rule.detectedIfRejected(),
                    String.format("Wrong document submitted: Extracted exam_class \"%s\" indicates 12th class, not 10th", raw)));
        }
        if ("marksheet_12".equals(documentType)
                && (examClass.contains("10") || examClass.contains(" x") || examClass.equals("x"))
                && !examClass.contains("12") && !examClass.contains("xii")) {
            return Optional.of(new TypeMismatch(rule.expected(), rule.detectedIfRejected(),
                    String.format("Wrong document submitted: Extracted exam_class \"%s\" indicates 10th class, not 12th", raw)));
        }
        return Optional.empty();
    }

    private static String buildSearchText(Map<String, String> extractedData, String remarks) {
        StringBuilder text = new StringBuilder();
        if (extractedData != null) {
            for (String value : extractedData.values()) {
                if (value != null) text.append(value).append(' ');
            }
        }
        if (remarks != null) text.append(remarks);
        return text.toString().trim();
    }
}
