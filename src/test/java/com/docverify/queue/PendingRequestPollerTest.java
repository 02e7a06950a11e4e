package com.docverify.queue;

import com.docverify.config.VerificationProperties;
import com.docverify.model.VerificationStatus;
import com.docverify.repository.VerificationRequestRepository;
import com.docverify.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PendingRequestPollerTest {

    @Mock private VerificationRequestRepository requestRepository;
    @Mock private VerificationJobQueue queue;

    private PendingRequestPoller poller;

    @BeforeEach
    void setUp() {
        VerificationProperties properties = new VerificationProperties();
        properties.getQueue().setPollBatchSize(5);
        poller = new PendingRequestPoller(requestRepository, queue, properties);
    }

    @Test
    void pollPending_enqueuesOnlyUntrackedRequests() {
        when(requestRepository.findPending(5)).thenReturn(List.of(
                TestDataFactory.createRequest("DOC1", "pan", VerificationStatus.ACCEPTED),
                TestDataFactory.createRequest("DOC2", "pan", VerificationStatus.ACCEPTED)));
        when(queue.isTracked("DOC1")).thenReturn(true);
        when(queue.isTracked("DOC2")).thenReturn(false);
        when(queue.enqueue(JobType.VERIFY_DOCUMENT, new JobPayload("DOC2"))).thenReturn("job_1");

        poller.pollPending();

        verify(queue, never()).enqueue(JobType.VERIFY_DOCUMENT, new JobPayload("DOC1"));
        verify(queue).enqueue(JobType.VERIFY_DOCUMENT, new JobPayload("DOC2"));
    }

    @Test
    void pollPending_nothingPending_enqueuesNothing() {
        when(requestRepository.findPending(5)).thenReturn(List.of());

        poller.pollPending();

        verify(queue, never()).enqueue(any(), any());
    }

    @Test
    void pollPending_storeUnavailable_doesNotPropagate() {
        when(requestRepository.findPending(5)).thenThrow(new RuntimeException("cluster unreachable"));

        assertThatCode(() -> poller.pollPending()).doesNotThrowAnyException();
        verify(queue, never()).enqueue(any(), any());
    }
}
