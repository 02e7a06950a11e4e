package com.docverify.service;

import com.docverify.config.MetricsConfig;
import com.docverify.model.BulkJob;
import com.docverify.model.BulkJobStatus;
import com.docverify.model.VerificationRequest;
import com.docverify.model.VerificationStatus;
import com.docverify.repository.BulkJobRepository;
import com.docverify.repository.VerificationRequestRepository;
import com.docverify.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BulkAggregatorTest {

    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

    @Mock private BulkJobRepository bulkJobRepository;
    @Mock private VerificationRequestRepository requestRepository;
    @Mock private WebhookDispatcher webhookDispatcher;
    @Mock private MetricsConfig metricsConfig;

    private BulkAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new BulkAggregator(bulkJobRepository, requestRepository, webhookDispatcher, metricsConfig,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void givenBulk(int total, VerificationStatus... statuses) {
        String[] ids = new String[statuses.length];
        VerificationRequest[] requests = new VerificationRequest[statuses.length];
        for (int i = 0; i < statuses.length; i++) {
            ids[i] = "DOC" + i;
            requests[i] = TestDataFactory.createRequest(ids[i], "pan", statuses[i]);
        }
        when(bulkJobRepository.findById("BULK1")).thenReturn(TestDataFactory.createBulkJob("BULK1", total));
        when(bulkJobRepository.findItems("BULK1")).thenReturn(TestDataFactory.createBulkItems("BULK1", ids));
        when(requestRepository.findByIds(List.of(ids))).thenReturn(List.of(requests));
    }

    @Test
    void recompute_itemsStillRunning_staysProcessing() {
        givenBulk(3, VerificationStatus.VERIFIED, VerificationStatus.PROCESSING, VerificationStatus.ACCEPTED);

        BulkJob job = aggregator.recompute("BULK1").orElseThrow();

        assertThat(job.getStatus()).isEqualTo(BulkJobStatus.PROCESSING);
        assertThat(job.getCompleted()).isEqualTo(1);
        assertThat(job.getVerified()).isEqualTo(1);
        assertThat(job.getCompletedAt()).isZero();
        verify(bulkJobRepository).updateProgress(job);
        verify(webhookDispatcher, never()).triggerBulkCompleted(any());
    }

    @Test
    void recompute_allVerified_completedAndNotified() {
        givenBulk(2, VerificationStatus.VERIFIED, VerificationStatus.VERIFIED);

        BulkJob job = aggregator.recompute("BULK1").orElseThrow();

        assertThat(job.getStatus()).isEqualTo(BulkJobStatus.COMPLETED);
        assertThat(job.getCompletedAt()).isEqualTo(NOW.toEpochMilli());
        verify(webhookDispatcher).triggerBulkCompleted(job);
        verify(metricsConfig).recordBulkFinished("completed");
    }

    @Test
    void recompute_mixedOutcomes_partial() {
        givenBulk(3, VerificationStatus.VERIFIED, VerificationStatus.REJECTED, VerificationStatus.FAILED);

        BulkJob job = aggregator.recompute("BULK1").orElseThrow();

        assertThat(job.getStatus()).isEqualTo(BulkJobStatus.PARTIAL);
        assertThat(job.getVerified()).isEqualTo(1);
        assertThat(job.getRejected()).isEqualTo(1);
        assertThat(job.getFailed()).isEqualTo(1);
        assertThat(job.getCompleted()).isEqualTo(3);
    }

    @Test
    void recompute_allFailed_failed() {
        givenBulk(2, VerificationStatus.FAILED, VerificationStatus.FAILED);

        assertThat(aggregator.recompute("BULK1")).map(BulkJob::getStatus).contains(BulkJobStatus.FAILED);
    }

    @Test
    void recompute_unknownBulk_empty() {
        when(bulkJobRepository.findById("BULK404")).thenReturn(null);

        Optional<BulkJob> result = aggregator.recompute("BULK404");

        assertThat(result).isEmpty();
        verify(bulkJobRepository, never()).updateProgress(any());
    }

    @Test
    void resolveStatus_laws() {
        assertThat(BulkAggregator.resolveStatus(0, 0, 0, 0)).isEqualTo(BulkJobStatus.PROCESSING);
        assertThat(BulkAggregator.resolveStatus(4, 3, 3, 0)).isEqualTo(BulkJobStatus.PROCESSING);
        assertThat(BulkAggregator.resolveStatus(4, 4, 4, 0)).isEqualTo(BulkJobStatus.COMPLETED);
        assertThat(BulkAggregator.resolveStatus(4, 4, 0, 4)).isEqualTo(BulkJobStatus.FAILED);
        assertThat(BulkAggregator.resolveStatus(4, 4, 0, 0)).isEqualTo(BulkJobStatus.PARTIAL);
        assertThat(BulkAggregator.resolveStatus(4, 4, 3, 1)).isEqualTo(BulkJobStatus.PARTIAL);
    }
}
