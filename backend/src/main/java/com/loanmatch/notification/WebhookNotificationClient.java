package com.loanmatch.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * POSTs the completion payload as JSON to the configured webhook. Any non-2xx status, transport error or timeout
 * fails the delivery.
 */
@Slf4j
public class WebhookNotificationClient implements NotificationClient {

    private final WebClient webClient;
    private final String webhookUrl;
    private final Duration timeout;

    public WebhookNotificationClient(WebClient.Builder builder, String webhookUrl, Duration timeout) {
        this.webClient = builder.build();
        this.webhookUrl = webhookUrl;
        this.timeout = timeout;
    }

    @Override
    public void batchMatched(BatchMatchedNotification notification) {
        try {
            webClient.post()
                    .uri(webhookUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(notification)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw new NotificationException("Webhook delivery failed for batch " + notification.batchId() + ": " + e.getMessage(), e);
        }
        log.info("Completion webhook delivered for batch {}", notification.batchId());
    }
}
