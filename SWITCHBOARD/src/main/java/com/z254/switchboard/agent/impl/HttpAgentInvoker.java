package com.z254.switchboard.agent.impl;

import com.z254.switchboard.agent.AgentInvoker;
import com.z254.switchboard.agent.PermanentAgentException;
import com.z254.switchboard.agent.TransientAgentException;
import com.z254.switchboard.config.SwitchboardProperties;
import com.z254.switchboard.domain.model.AgentDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * WebClient-based implementation of AgentInvoker.
 * POSTs the payload as JSON to the agent's endpoint and returns the JSON response body.
 * <p>
 * HTTP 4xx responses are permanent failures; 5xx responses, connection errors and response
 * timeouts are transient.
 */
@Slf4j
public class HttpAgentInvoker implements AgentInvoker {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;
    private final SwitchboardProperties.InvokerProperties.HttpInvokerProperties config;

    public HttpAgentInvoker(WebClient.Builder webClientBuilder,
                            SwitchboardProperties.InvokerProperties.HttpInvokerProperties config) {
        this.config = config;
        this.webClient = webClientBuilder
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeaders(headers -> config.getHeaders().forEach(headers::add))
                .build();
    }

    @Override
    public Mono<Map<String, Object>> invoke(AgentDescriptor descriptor, Map<String, Object> payload) {
        String endpoint = descriptor.getEndpoint();
        if (!isHttpEndpoint(endpoint)) {
            return Mono.error(new PermanentAgentException(descriptor.getId(),
                    "Endpoint is not an http(s) URL: " + endpoint));
        }

        return webClient.post()
                .uri(endpoint)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new PermanentAgentException(descriptor.getId(),
                                "Agent rejected request with HTTP " + response.statusCode().value()
                                        + (body.isEmpty() ? "" : ": " + body))))
                .onStatus(HttpStatusCode::is5xxServerError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new TransientAgentException(descriptor.getId(),
                                "Agent failed with HTTP " + response.statusCode().value())))
                .bodyToMono(JSON_OBJECT)
                .timeout(config.getResponseTimeout())
                .onErrorMap(WebClientRequestException.class, e -> new TransientAgentException(descriptor.getId(),
                        "Could not reach agent: " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class, e -> new TransientAgentException(descriptor.getId(),
                        "No response within " + config.getResponseTimeout(), e))
                .doOnSuccess(response -> log.debug("Agent {} responded", descriptor.getId()))
                .doOnError(e -> log.error("Call to agent {} failed: {}", descriptor.getId(), e.getMessage()));
    }

    private static boolean isHttpEndpoint(String endpoint) {
        if (endpoint == null) {
            return false;
        }
        String lower = endpoint.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }
}
