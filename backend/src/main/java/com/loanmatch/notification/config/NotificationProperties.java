package com.loanmatch.notification.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Completion notification settings under loanmatch.notification.
 */
@ConfigurationProperties(prefix = "loanmatch.notification")
@NoArgsConstructor
@Getter
@Setter
public class NotificationProperties {

    /** Webhook URL; blank logs completions instead. */
    private String webhookUrl = "";

    private Duration timeout = Duration.ofSeconds(10);
}
