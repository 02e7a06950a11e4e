package com.docverify.service;

import com.docverify.model.AuditAction;
import com.docverify.model.Webhook;
import com.docverify.model.WebhookEvent;
import com.docverify.repository.WebhookDeliveryRepository;
import com.docverify.repository.WebhookRepository;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookServiceTest {

    @Mock private WebhookRepository webhookRepository;
    @Mock private WebhookDeliveryRepository deliveryRepository;
    @Mock private AuditService auditService;

    private WebhookService service;

    @BeforeEach
    void setUp() {
        service = new WebhookService(webhookRepository, deliveryRepository, new WebhookSigner(), auditService,
                Clock.fixed(Instant.parse("2025-06-15T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void register_noEvents_subscribesToDocumentEventsAndReturnsSecret() {
        Webhook webhook = service.register(TestDataFactory.OWNER, "https://hooks.example.com/a", null);

        assertThat(webhook.getEvents()).containsExactlyElementsOf(WebhookEvent.DEFAULT_SUBSCRIPTION);
        assertThat(webhook.getSecret()).startsWith("whsec_");
        assertThat(webhook.isActive()).isTrue();
        verify(webhookRepository).save(webhook);
        verify(auditService).record(eq(TestDataFactory.OWNER), eq(AuditAction.WEBHOOK_REGISTERED),
                eq(AuditService.RESOURCE_WEBHOOK), eq(webhook.getWebhookId()), any());
    }

    @Test
    void register_bulkEvent_accepted() {
        Webhook webhook = service.register(TestDataFactory.OWNER, "https://hooks.example.com/a",
                List.of("bulk.completed", "document.failed", "bulk.completed"));

        assertThat(webhook.getEvents()).containsExactly(WebhookEvent.BULK_COMPLETED, WebhookEvent.DOCUMENT_FAILED);
    }

    @Test
    void register_unknownEvents_listedInError() {
        assertThatThrownBy(() -> service.register(TestDataFactory.OWNER, "https://hooks.example.com/a",
                List.of("document.verified", "document.deleted", "nope")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid events: document.deleted, nope");
        verify(webhookRepository, never()).save(any());
    }

    @Test
    void register_invalidUrl_rejected() {
        assertThatThrownBy(() -> service.register(TestDataFactory.OWNER, "ftp://hooks.example.com", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.register(TestDataFactory.OWNER, "not a url", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void update_changesOnlyGivenFieldsAndRedactsSecret() {
        Webhook existing = TestDataFactory.createWebhook("wh1", 2);
        when(webhookRepository.findById("wh1")).thenReturn(existing);

        Webhook updated = service.update(TestDataFactory.OWNER, "wh1", null, null, false);

        assertThat(updated.isActive()).isFalse();
        assertThat(updated.getUrl()).isEqualTo("https://hooks.example.com/wh1");
        assertThat(updated.getSecret()).isNull();
        verify(webhookRepository).save(existing);
    }

    @Test
    void update_emptyEventList_rejected() {
        when(webhookRepository.findById("wh1")).thenReturn(TestDataFactory.createWebhook("wh1", 0));

        assertThatThrownBy(() -> service.update(TestDataFactory.OWNER, "wh1", null, List.of(), null))
                .isInstanceOf(IllegalArgumentException.class);
        verify(webhookRepository, never()).save(any());
    }

    @Test
    void delete_otherOwnersWebhook_notFound() {
        Webhook foreign = TestDataFactory.createWebhook("wh1", 0);
        foreign.setOwnerId("owner-2");
        when(webhookRepository.findById("wh1")).thenReturn(foreign);

        assertThatThrownBy(() -> service.delete(TestDataFactory.OWNER, "wh1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Webhook not found: wh1");
        verify(webhookRepository, never()).delete(any());
    }

    @Test
    void delete_ownWebhook_deletedAndAudited() {
        when(webhookRepository.findById("wh1")).thenReturn(TestDataFactory.createWebhook("wh1", 0));

        service.delete(TestDataFactory.OWNER, "wh1");

        verify(webhookRepository).delete("wh1");
        verify(auditService).record(TestDataFactory.OWNER, AuditAction.WEBHOOK_DELETED,
                AuditService.RESOURCE_WEBHOOK, "wh1", null);
    }

    @Test
    void list_secretsRedacted() {
        when(webhookRepository.findByOwner(TestDataFactory.OWNER))
                .thenReturn(List.of(TestDataFactory.createWebhook("wh1", 0), TestDataFactory.createWebhook("wh2", 0)));

        assertThat(service.list(TestDataFactory.OWNER)).extracting(Webhook::getSecret).containsOnlyNulls();
    }

    @Test
    void deliveries_defaultLimit() {
        when(webhookRepository.findById("wh1")).thenReturn(TestDataFactory.createWebhook("wh1", 0));

        service.deliveries(TestDataFactory.OWNER, "wh1", null);

        verify(deliveryRepository).findByWebhook("wh1", 50);
    }
}
