package com.z254.switchboard.agent.impl;

import com.z254.switchboard.agent.PermanentAgentException;
import com.z254.switchboard.agent.TransientAgentException;
import com.z254.switchboard.config.SwitchboardProperties;
import com.z254.switchboard.domain.model.AgentCapability;
import com.z254.switchboard.domain.model.AgentDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link HttpAgentInvoker}.
 */
class HttpAgentInvokerTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();
    private SwitchboardProperties.InvokerProperties.HttpInvokerProperties config;
    private AgentDescriptor sales;

    @BeforeEach
    void setUp() {
        config = new SwitchboardProperties.InvokerProperties.HttpInvokerProperties();
        config.setResponseTimeout(Duration.ofMillis(300));
        config.getHeaders().put("X-Caller", "switchboard");
        sales = AgentDescriptor.builder()
                .id("sales")
                .name("Sales Agent")
                .endpoint("http://sales.local/invoke")
                .capability(AgentCapability.LEAD_QUALIFICATION)
                .build();
    }

    private HttpAgentInvoker invokerReturning(ExchangeFunction exchange) {
        ExchangeFunction recording = request -> {
            lastRequest.set(request);
            return exchange.exchange(request);
        };
        return new HttpAgentInvoker(WebClient.builder().exchangeFunction(recording), config);
    }

    private static ExchangeFunction respond(HttpStatus status, String body) {
        return request -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    @Test
    @DisplayName("should POST to the agent endpoint and return the JSON body")
    void returnsJsonBody() {
        HttpAgentInvoker invoker = invokerReturning(respond(HttpStatus.OK, "{\"leadScore\":87,\"qualified\":true}"));

        StepVerifier.create(invoker.invoke(sales, Map.of("company", "Acme")))
                .assertNext(output -> assertThat(output)
                        .containsEntry("leadScore", 87)
                        .containsEntry("qualified", true))
                .verifyComplete();

        ClientRequest request = lastRequest.get();
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().toString()).isEqualTo("http://sales.local/invoke");
        assertThat(request.headers().getFirst("X-Caller")).isEqualTo("switchboard");
        assertThat(request.headers().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
    }

    @Test
    @DisplayName("should map 4xx responses to permanent failures")
    void clientErrorIsPermanent() {
        HttpAgentInvoker invoker = invokerReturning(respond(HttpStatus.BAD_REQUEST, "missing field"));

        StepVerifier.create(invoker.invoke(sales, Map.of()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(PermanentAgentException.class);
                    assertThat(error.getMessage()).isEqualTo("Agent rejected request with HTTP 400: missing field");
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("should map 5xx responses to transient failures")
    void serverErrorIsTransient() {
        HttpAgentInvoker invoker = invokerReturning(respond(HttpStatus.SERVICE_UNAVAILABLE, ""));

        StepVerifier.create(invoker.invoke(sales, Map.of()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(TransientAgentException.class);
                    assertThat(error.getMessage()).isEqualTo("Agent failed with HTTP 503");
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("should fail transiently when the agent does not answer in time")
    void responseTimeout() {
        HttpAgentInvoker invoker = invokerReturning(request -> Mono.never());

        StepVerifier.create(invoker.invoke(sales, Map.of()))
                .expectError(TransientAgentException.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("should reject endpoints that are not http URLs without calling out")
    void nonHttpEndpoint() {
        HttpAgentInvoker invoker = invokerReturning(respond(HttpStatus.OK, "{}"));
        AgentDescriptor queued = sales.toBuilder().endpoint("amqp://broker/sales").build();

        StepVerifier.create(invoker.invoke(queued, Map.of()))
                .expectError(PermanentAgentException.class)
                .verify(Duration.ofSeconds(5));
        assertThat(lastRequest.get()).isNull();
    }
}
