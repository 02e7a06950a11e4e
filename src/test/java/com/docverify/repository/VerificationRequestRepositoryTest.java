package com.docverify.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.docverify.model.VerdictUpdate;
import com.docverify.model.VerificationRequest;
import com.docverify.model.VerificationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VerificationRequestRepositoryTest {

    @Mock private AerospikeClient client;

    private final WritePolicy writePolicy = new WritePolicy();
    private final List<WritePolicy> writtenPolicies = new ArrayList<>();
    private final List<Bin> writtenBins = new ArrayList<>();
    private VerificationRequestRepository repository;

    @BeforeEach
    void setUp() {
        repository = new VerificationRequestRepository(client, "test", writePolicy, new Policy());
    }

    private void recordWrites() {
        doAnswer(inv -> {
            writtenPolicies.add(inv.getArgument(0));
            writtenBins.addAll(List.of((Bin[]) inv.getRawArguments()[2]));
            return null;
        }).when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));
    }

    private Map<String, Object> writtenValues() {
        return writtenBins.stream().collect(Collectors.toMap(b -> b.name, b -> b.value.getObject() == null
                ? "<null>" : b.value.getObject()));
    }

    private void givenStatus(VerificationStatus status, int generation) {
        when(client.get(any(Policy.class), any(Key.class), eq("status")))
                .thenReturn(new Record(new HashMap<>(Map.of("status", status.name())), generation, 0));
    }

    @Test
    void transition_expectedStatus_writesConditionallyOnGeneration() {
        givenStatus(VerificationStatus.ACCEPTED, 7);
        recordWrites();

        boolean changed = repository.transition("DOC1", VerificationStatus.ACCEPTED, VerificationStatus.PROCESSING);

        assertThat(changed).isTrue();
        WritePolicy used = writtenPolicies.get(0);
        assertThat(used.generationPolicy).isEqualTo(GenerationPolicy.EXPECT_GEN_EQUAL);
        assertThat(used.generation).isEqualTo(7);
        assertThat(writePolicy.generationPolicy).isEqualTo(GenerationPolicy.NONE);
        assertThat(writtenValues()).containsOnly(Map.entry("status", "PROCESSING"));
    }

    @Test
    void transition_differentStatus_noWrite() {
        givenStatus(VerificationStatus.PROCESSING, 3);

        assertThat(repository.transition("DOC1", VerificationStatus.ACCEPTED, VerificationStatus.PROCESSING)).isFalse();
        verify(client, never()).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));
    }

    @Test
    void transition_missingRecord_false() {
        when(client.get(any(Policy.class), any(Key.class), eq("status"))).thenReturn(null);

        assertThat(repository.transition("DOC1", VerificationStatus.ACCEPTED, VerificationStatus.PROCESSING)).isFalse();
    }

    @Test
    void transition_concurrentWriter_losesRace() {
        givenStatus(VerificationStatus.ACCEPTED, 2);
        doThrow(new AerospikeException(ResultCode.GENERATION_ERROR))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThat(repository.transition("DOC1", VerificationStatus.ACCEPTED, VerificationStatus.PROCESSING)).isFalse();
    }

    @Test
    void transition_otherStoreError_propagates() {
        givenStatus(VerificationStatus.ACCEPTED, 2);
        doThrow(new AerospikeException(ResultCode.TIMEOUT))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThatThrownBy(() -> repository.transition("DOC1", VerificationStatus.ACCEPTED, VerificationStatus.PROCESSING))
                .isInstanceOf(AerospikeException.class);
    }

    @Test
    void updateVerdict_statusOnly_leavesOtherFieldsAlone() {
        recordWrites();

        repository.updateVerdict("DOC1", VerdictUpdate.statusOnly(VerificationStatus.ACCEPTED));

        assertThat(writtenValues()).containsOnlyKeys("status");
    }

    @Test
    void updateVerdict_failed_writesIssuesAndStampsProcessedAt() {
        recordWrites();

        repository.updateVerdict("DOC1", VerdictUpdate.failed("Extraction service timed out"));

        assertThat(writtenValues())
                .containsEntry("status", "FAILED")
                .containsEntry("issues", "[\"Extraction service timed out\"]")
                .containsKey("processedAt")
                .doesNotContainKeys("confidence", "riskScore");
    }

    @Test
    void findById_mapsRecordAndEmptyStringsToNull() {
        Map<String, Object> bins = new HashMap<>();
        bins.put("refId", "DOC1");
        bins.put("clientRef", "");
        bins.put("ownerId", "owner-1");
        bins.put("docType", "pan");
        bins.put("fileUrl", "https://files.example.com/doc.jpg");
        bins.put("metadata", "{\"name\":\"Ravi Kumar\"}");
        bins.put("status", "REJECTED");
        bins.put("confidence", 45.0);
        bins.put("extracted", "{\"pan_number\":\"1234ABCDEF\"}");
        bins.put("issues", "[\"ID format mismatch\"]");
        bins.put("aiResponse", "");
        bins.put("bulkJobId", "");
        bins.put("createdAt", 1000L);
        bins.put("processedAt", 2000L);
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(new Record(bins, 1, 0));

        VerificationRequest request = repository.findById("DOC1");

        assertThat(request.getStatus()).isEqualTo(VerificationStatus.REJECTED);
        assertThat(request.getClientReferenceId()).isNull();
        assertThat(request.getBulkJobId()).isNull();
        assertThat(request.getAiResponse()).isNull();
        assertThat(request.getConfidence()).isEqualTo(45.0);
        assertThat(request.getRiskScore()).isNull();
        assertThat(request.getMetadata()).containsEntry("name", "Ravi Kumar");
        assertThat(request.getExtractedData()).containsEntry("pan_number", "1234ABCDEF");
        assertThat(request.getIssues()).containsExactly("ID format mismatch");
        assertThat(request.getProcessedAt()).isEqualTo(2000L);
    }

    @Test
    void findById_missing_null() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(null);

        assertThat(repository.findById("DOC404")).isNull();
    }
}
