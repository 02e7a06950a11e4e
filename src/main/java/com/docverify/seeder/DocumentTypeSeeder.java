package com.docverify.seeder;

import com.docverify.model.DocumentTypeConfig;
import com.docverify.repository.DocumentTypeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates the global document types on startup. Existing definitions are left untouched, so
 * edits made after the first start survive restarts.
 */
@Component
@Profile("!test")
@Order(1)
public class DocumentTypeSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DocumentTypeSeeder.class);

    private final DocumentTypeRepository documentTypeRepository;

    public DocumentTypeSeeder(DocumentTypeRepository documentTypeRepository) {
        this.documentTypeRepository = documentTypeRepository;
    }

    @Override
    public void run(String... args) {
        int created = 0;
        for (DocumentTypeConfig type : defaultTypes()) {
            if (documentTypeRepository.exists(type.getCode(), null)) {
                continue;
            }
            documentTypeRepository.save(type);
            created++;
            log.info("Seeded global document type: {} ({})", type.getCode(), type.getName());
        }
        log.info("Document type seeding done: {} created", created);
    }

    static List<DocumentTypeConfig> defaultTypes() {
        return List.of(
                type("aadhaar", "Aadhaar Card", 5, List.of("jpg", "png", "pdf"),
                        List.of("name", "dob", "id_number"),
                        rules("id_number", "^[0-9]{4}\\s?[0-9]{4}\\s?[0-9]{4}$")),
                type("pan", "PAN Card", 5, List.of("jpg", "png", "pdf"),
                        List.of("name", "pan_number", "dob"),
                        rules("pan_number", "^[A-Z]{5}[0-9]{4}[A-Z]$")),
                type("passport", "Passport", 10, List.of("jpg", "png", "pdf"),
                        List.of("name", "passport_number", "dob", "expiry_date", "nationality"),
                        rules("passport_number", "^[A-Z][0-9]{7}$")),
                type("driving_license", "Driving License", 5, List.of("jpg", "png", "pdf"),
                        List.of("name", "license_number", "dob", "expiry_date"), Map.of()),
                type("voter_id", "Voter ID", 5, List.of("jpg", "png", "pdf"),
                        List.of("name", "voter_id_number", "dob"), Map.of()),
                type("bank_statement", "Bank Statement", 10, List.of("pdf"),
                        List.of("account_holder_name", "account_number", "bank_name"), Map.of()),
                type("utility_bill", "Utility Bill", 5, List.of("jpg", "png", "pdf"),
                        List.of("name", "address", "bill_date"), Map.of()),
                type("marksheet_10", "10th Marksheet", 5, List.of("jpg", "png", "pdf"),
                        List.of("name", "roll_number", "percentage", "board"), Map.of()),
                type("marksheet_12", "12th Marksheet", 5, List.of("jpg", "png", "pdf"),
                        List.of("name", "roll_number", "percentage", "board"), Map.of()),
                type("graduation_cert", "Graduation Certificate", 5, List.of("jpg", "png", "pdf"),
                        List.of("name", "degree", "university", "year_of_passing"), Map.of()));
    }

    private static DocumentTypeConfig type(String code, String name, int maxSizeMb, List<String> formats,
                                           List<String> requiredFields, Map<String, String> validationRules) {
        return DocumentTypeConfig.builder()
                .code(code)
                .name(name)
                .maxSizeMb(maxSizeMb)
                .allowedFormats(formats)
                .requiredFields(requiredFields)
                .validationRules(new LinkedHashMap<>(validationRules))
                .active(true)
                .build();
    }

    private static Map<String, String> rules(String field, String regex) {
        return Map.of(field, regex);
    }
}
