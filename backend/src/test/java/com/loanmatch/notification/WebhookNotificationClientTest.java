package com.loanmatch.notification;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookNotificationClientTest {

    private static final BatchMatchedNotification NOTIFICATION =
            new BatchMatchedNotification("B1", 120, 45, Instant.parse("2025-03-01T10:00:00Z"));

    @Test
    void delivers_postToConfiguredUrl() {
        AtomicReference<ClientRequest> seen = new AtomicReference<>();
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            seen.set(request);
            return Mono.just(ClientResponse.create(HttpStatus.NO_CONTENT).build());
        });

        new WebhookNotificationClient(builder, "http://hooks.local/matched", Duration.ofSeconds(2)).batchMatched(NOTIFICATION);

        assertThat(seen.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(seen.get().url()).isEqualTo(URI.create("http://hooks.local/matched"));
    }

    @Test
    void non2xx_failsDelivery() {
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.BAD_GATEWAY).build()));
        WebhookNotificationClient client = new WebhookNotificationClient(builder, "http://hooks.local/matched", Duration.ofSeconds(2));

        assertThatThrownBy(() -> client.batchMatched(NOTIFICATION))
                .isInstanceOf(NotificationException.class)
                .hasMessageContaining("B1");
    }

    @Test
    void slowWebhook_timesOut() {
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(request -> Mono.<ClientResponse>never());
        WebhookNotificationClient client = new WebhookNotificationClient(builder, "http://hooks.local/matched", Duration.ofMillis(100));

        assertThatThrownBy(() -> client.batchMatched(NOTIFICATION)).isInstanceOf(NotificationException.class);
    }
}
