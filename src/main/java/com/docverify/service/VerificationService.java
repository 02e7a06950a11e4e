package com.docverify.service;

import com.docverify.model.AuditAction;
import com.docverify.model.AuditEntry;
import com.docverify.model.BulkJob;
import com.docverify.model.BulkJobDetails;
import com.docverify.model.BulkJobItem;
import com.docverify.model.BulkJobStatus;
import com.docverify.model.DocumentSubmission;
import com.docverify.model.VerificationRequest;
import com.docverify.model.VerificationStatus;
import com.docverify.queue.JobPayload;
import com.docverify.queue.JobType;
import com.docverify.queue.VerificationJobQueue;
import com.docverify.repository.BulkJobRepository;
import com.docverify.repository.VerificationRequestRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Entry points for callers: single and bulk submission, reprocessing and lookups.
 * Submissions are persisted as ACCEPTED and handed to the queue; the verdict arrives later.
 */
@Service
public class VerificationService {

    private static final Logger log = LoggerFactory.getLogger(VerificationService.class);

    private static final int DEFAULT_LIST_LIMIT = 50;
    private static final int MAX_LIST_LIMIT = 100;

    private final VerificationRequestRepository requestRepository;
    private final BulkJobRepository bulkJobRepository;
    private final VerificationJobQueue jobQueue;
    private final AuditService auditService;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public VerificationService(VerificationRequestRepository requestRepository,
                               BulkJobRepository bulkJobRepository,
                               VerificationJobQueue jobQueue,
                               AuditService auditService,
                               Clock clock) {
        this.requestRepository = requestRepository;
        this.bulkJobRepository = bulkJobRepository;
        this.jobQueue = jobQueue;
        this.auditService = auditService;
        this.clock = clock;
    }

    @Observed(name = "verification.submit", contextualName = "submit-verification")
    public VerificationRequest submit(String ownerId, DocumentSubmission submission) {
        VerificationRequest request = createRequest(ownerId, submission, null);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("document_type", request.getDocumentType());
        details.put("client_reference_id", request.getClientReferenceId());
        auditService.recordVerification(ownerId, AuditAction.VERIFICATION_SUBMITTED,
                request.getSystemReferenceId(), details);

        jobQueue.enqueue(JobType.VERIFY_DOCUMENT, new JobPayload(request.getSystemReferenceId()));
        log.info("Accepted {} document as {} for owner {}",
                request.getDocumentType(), request.getSystemReferenceId(), ownerId);
        return request;
    }

    /**
     * Create one request per document, link them to a new bulk job and queue them all.
     */
    @Observed(name = "verification.submit-bulk", contextualName = "submit-bulk-verification")
    public BulkJob createBulk(String ownerId, List<DocumentSubmission> documents,
                              String callbackUrl, Map<String, String> metadata) {
        if (documents == null || documents.isEmpty()) {
            throw new IllegalArgumentException("A bulk job needs at least one document");
        }
        documents.forEach(this::checkSubmission);

        long now = clock.millis();
        BulkJob job = BulkJob.builder()
                .bulkId(newId("BULK"))
                .ownerId(ownerId)
                .totalDocuments(documents.size())
                .status(BulkJobStatus.QUEUED)
                .callbackUrl(callbackUrl)
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                .createdAt(now)
                .build();
        bulkJobRepository.save(job);

        List<String> requestIds = new ArrayList<>();
        for (int i = 0; i < documents.size(); i++) {
            VerificationRequest request = createRequest(ownerId, documents.get(i), job.getBulkId());
            bulkJobRepository.saveItem(BulkJobItem.builder()
                    .bulkId(job.getBulkId())
                    .requestId(request.getSystemReferenceId())
                    .itemIndex(i)
                    .createdAt(now)
                    .build());
            requestIds.add(request.getSystemReferenceId());
        }

        bulkJobRepository.updateStatus(job.getBulkId(), BulkJobStatus.PROCESSING);
        job.setStatus(BulkJobStatus.PROCESSING);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("total_documents", documents.size());
        auditService.record(ownerId, AuditAction.BULK_SUBMITTED, AuditService.RESOURCE_BULK_JOB,
                job.getBulkId(), details);

        requestIds.forEach(id -> jobQueue.enqueue(JobType.VERIFY_DOCUMENT, new JobPayload(id)));
        log.info("Bulk job {} accepted with {} documents for owner {}", job.getBulkId(), documents.size(), ownerId);
        return job;
    }

    /**
     * Put a finished request back through the pipeline with its scoring fields cleared.
     */
    public VerificationRequest reprocess(String ownerId, String requestId) {
        VerificationRequest request = findByReference(ownerId, requestId);
        if (!request.getStatus().isTerminal()) {
            throw new IllegalStateException(String.format(
                    "Request %s is %s and cannot be reprocessed until it finishes",
                    requestId, request.getStatus().value()));
        }

        VerificationStatus previous = request.getStatus();
        requestRepository.resetForReprocess(requestId);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("previous_status", previous.value());
        auditService.recordVerification(ownerId, AuditAction.DOCUMENT_REPROCESSED, requestId, details);

        String jobId = jobQueue.enqueue(JobType.VERIFY_DOCUMENT, new JobPayload(requestId));
        if (jobId == null) {
            // the previous job has not released the request yet
            log.warn("Request {} reset for reprocessing while its previous job is still finishing; "
                    + "it will be picked up by the pending-request poller", requestId);
        } else {
            log.info("Request {} queued for reprocessing as job {} (was {})", requestId, jobId, previous);
        }

        request.setStatus(VerificationStatus.ACCEPTED);
        request.setConfidence(null);
        request.setRiskScore(null);
        request.setExtractedData(new LinkedHashMap<>());
        request.setIssues(new ArrayList<>());
        request.setAiResponse(null);
        request.setProcessedAt(0L);
        return request;
    }

    /**
     * @throws IllegalArgumentException if the request does not exist or belongs to another owner
     */
    public VerificationRequest findByReference(String ownerId, String requestId) {
        VerificationRequest request = requestRepository.findById(requestId);
        if (request == null || !request.getOwnerId().equals(ownerId)) {
            throw new IllegalArgumentException("Verification request not found: " + requestId);
        }
        return request;
    }

    /**
     * Audit entries of one of the owner's requests, oldest first.
     */
    public List<AuditEntry> auditTrail(String ownerId, String requestId) {
        findByReference(ownerId, requestId);
        return auditService.history(requestId);
    }

    public List<VerificationRequest> listForOwner(String ownerId, VerificationStatus status, Integer limit) {
        int effectiveLimit = limit == null || limit <= 0 ? DEFAULT_LIST_LIMIT : Math.min(limit, MAX_LIST_LIMIT);
        return requestRepository.findByOwner(ownerId, status, effectiveLimit);
    }

    public BulkJobDetails getBulkJob(String ownerId, String bulkId) {
        BulkJob job = bulkJobRepository.findById(bulkId);
        if (job == null || !job.getOwnerId().equals(ownerId)) {
            throw new IllegalArgumentException("Bulk job not found: " + bulkId);
        }
        List<String> requestIds = bulkJobRepository.findItems(bulkId).stream()
                .map(BulkJobItem::getRequestId)
                .toList();
        return new BulkJobDetails(job, requestRepository.findByIds(requestIds));
    }

    private VerificationRequest createRequest(String ownerId, DocumentSubmission submission, String bulkJobId) {
        checkSubmission(submission);
        VerificationRequest request = VerificationRequest.builder()
                .systemReferenceId(newId("DOC"))
                .clientReferenceId(submission.clientReferenceId())
                .ownerId(ownerId)
                .documentType(submission.documentType())
                .fileUrl(submission.fileUrl())
                .metadata(submission.metadata() != null ? new LinkedHashMap<>(submission.metadata()) : new LinkedHashMap<>())
                .status(VerificationStatus.ACCEPTED)
                .bulkJobId(bulkJobId)
                .createdAt(clock.millis())
                .build();
        requestRepository.save(request);
        return request;
    }

    private void checkSubmission(DocumentSubmission submission) {
        if (submission == null) {
            throw new IllegalArgumentException("Submission is required");
        }
        if (submission.documentType() == null || submission.documentType().isBlank()) {
            throw new IllegalArgumentException("document_type is required");
        }
        if (submission.fileUrl() == null || submission.fileUrl().isBlank()) {
            throw new IllegalArgumentException("file_url is required");
        }
    }

    // PREFIX + base-36 millis + 8 random hex chars, upper case
    private String newId(String prefix) {
        byte[] bytes = new byte[4];
        random.nextBytes(bytes);
        return prefix + Long.toString(clock.millis(), 36).toUpperCase(Locale.ROOT)
                + HexFormat.of().withUpperCase().formatHex(bytes);
    }
}
