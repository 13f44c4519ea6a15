package com.example.crmaccess.observability.filter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    private CorrelationIdFilter filter;
    private AtomicReference<String> seenCorrelationId;
    private WebFilterChain chain;

    @BeforeEach
    void setUp() {
        filter = new CorrelationIdFilter();
        seenCorrelationId = new AtomicReference<>();
        chain = exchange -> CorrelationIdFilter.getCorrelationId()
                .doOnNext(seenCorrelationId::set)
                .then();
    }

    @Test
    @DisplayName("should propagate the incoming correlation id")
    void shouldPropagateIncomingId() {
        MockServerWebExchange exchange = MockServerWebExchange.from(
                MockServerHttpRequest.post("/api/v1/permissions/check")
                        .header(CorrelationIdFilter.CORRELATION_ID_HEADER, "abc-123"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(seenCorrelationId.get()).isEqualTo("abc-123");
        assertThat(exchange.getResponse().getHeaders().getFirst(CorrelationIdFilter.CORRELATION_ID_HEADER))
                .isEqualTo("abc-123");
    }

    @Test
    @DisplayName("should fall back to the request id header")
    void shouldFallBackToRequestId() {
        MockServerWebExchange exchange = MockServerWebExchange.from(
                MockServerHttpRequest.get("/").header(CorrelationIdFilter.REQUEST_ID_HEADER, "req-9"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(seenCorrelationId.get()).isEqualTo("req-9");
    }

    @Test
    @DisplayName("should generate an id when none is supplied and truncate oversized ones")
    void shouldGenerateAndTruncate() {
        MockServerWebExchange generated = MockServerWebExchange.from(MockServerHttpRequest.get("/"));
        StepVerifier.create(filter.filter(generated, chain)).verifyComplete();
        assertThat(seenCorrelationId.get()).hasSize(36);

        MockServerWebExchange oversized = MockServerWebExchange.from(
                MockServerHttpRequest.get("/").header(CorrelationIdFilter.CORRELATION_ID_HEADER, "x".repeat(100)));
        StepVerifier.create(filter.filter(oversized, chain)).verifyComplete();
        assertThat(seenCorrelationId.get()).hasSize(64);
    }

    @Test
    @DisplayName("getCorrelationId should default to unknown outside a request")
    void shouldDefaultOutsideRequest() {
        StepVerifier.create(CorrelationIdFilter.getCorrelationId())
                .expectNext("unknown")
                .verifyComplete();
    }
}
