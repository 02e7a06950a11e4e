package com.docverify.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Append-only record of a single delivery attempt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookDelivery {
    private String deliveryId;
    private String webhookId;
    private String subjectId;           // verification request id, or bulk id for bulk.completed
    private String event;
    private String payload;
    private Integer responseStatus;     // null when the request never got a response
    private String responseBody;
    private DeliveryStatus status;
    private long attemptedAt;
}
