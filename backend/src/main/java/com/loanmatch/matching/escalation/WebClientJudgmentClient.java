package com.loanmatch.matching.escalation;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Judgment client over HTTP: POST {baseUrl}{path} with the feature summary as JSON.
 */
public class WebClientJudgmentClient implements JudgmentClient {

    private final WebClient webClient;
    private final String path;

    public WebClientJudgmentClient(WebClient.Builder builder, String baseUrl, String path) {
        this.webClient = builder.baseUrl(baseUrl).build();
        this.path = path;
    }

    @Override
    public Mono<String> judge(JudgmentRequest request) {
        return webClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class,
                        e -> new JudgmentException("Judgment service returned " + e.getStatusCode().value(), e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new JudgmentException("Judgment service unreachable: " + e.getMessage(), e));
    }
}
