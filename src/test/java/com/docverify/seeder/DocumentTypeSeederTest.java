package com.docverify.seeder;

import com.docverify.model.DocumentTypeConfig;
import com.docverify.repository.DocumentTypeRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentTypeSeederTest {

    @Mock private DocumentTypeRepository documentTypeRepository;

    @Test
    void run_createsOnlyMissingGlobalTypes() {
        when(documentTypeRepository.exists(any(), isNull())).thenReturn(false);
        when(documentTypeRepository.exists("pan", null)).thenReturn(true);

        new DocumentTypeSeeder(documentTypeRepository).run();

        ArgumentCaptor<DocumentTypeConfig> captor = ArgumentCaptor.forClass(DocumentTypeConfig.class);
        verify(documentTypeRepository, times(9)).save(captor.capture());
        assertThat(captor.getAllValues()).extracting(DocumentTypeConfig::getCode).doesNotContain("pan");
        assertThat(captor.getAllValues()).allSatisfy(type -> assertThat(type.isGlobal()).isTrue());
    }

    @Test
    void defaultTypes_validationRulesCompileAndCoverIdentityDocuments() {
        assertThat(DocumentTypeSeeder.defaultTypes()).extracting(DocumentTypeConfig::getCode).containsExactly(
                "aadhaar", "pan", "passport", "driving_license", "voter_id", "bank_statement",
                "utility_bill", "marksheet_10", "marksheet_12", "graduation_cert");

        DocumentTypeSeeder.defaultTypes().forEach(type ->
                type.getValidationRules().values().forEach(Pattern::compile));

        DocumentTypeConfig pan = DocumentTypeSeeder.defaultTypes().get(1);
        assertThat(pan.getRequiredFields()).contains("pan_number");
        assertThat(Pattern.compile(pan.getValidationRules().get("pan_number")).matcher("ABCDE1234F").matches()).isTrue();
    }
}
