package com.loanmatch.notification.config;

import com.loanmatch.notification.LoggingNotificationClient;
import com.loanmatch.notification.NotificationClient;
import com.loanmatch.notification.WebhookNotificationClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(NotificationProperties.class)
@Slf4j
public class NotificationConfig {

    @Bean
    @ConditionalOnMissingBean(NotificationClient.class)
    public NotificationClient notificationClient(NotificationProperties properties, WebClient.Builder webClientBuilder) {
        if (properties.getWebhookUrl() == null || properties.getWebhookUrl().isBlank()) {
            log.info("loanmatch.notification.webhook-url not set; batch completions will be logged only");
            return new LoggingNotificationClient();
        }
        return new WebhookNotificationClient(webClientBuilder, properties.getWebhookUrl(), properties.getTimeout());
    }
}
