package com.example.crmaccess.observability.filter;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;

/**
 * Gives every request a correlation id: taken from X-Correlation-Id or X-Request-Id,
 * generated otherwise. Propagated through the Reactor context and MDC and echoed
 * back in the response headers.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CORRELATION_ID_KEY = "correlationId";

    private static final int MAX_CORRELATION_ID_LENGTH = 64;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String correlationId = extractOrGenerateCorrelationId(exchange.getRequest());
        String requestPath = exchange.getRequest().getPath().value();

        exchange.getResponse().getHeaders().add(CORRELATION_ID_HEADER, correlationId);

        return chain.filter(exchange)
                .contextWrite(Context.of(CORRELATION_ID_KEY, correlationId))
                .doFirst(() -> {
                    MDC.put(CORRELATION_ID_KEY, correlationId);
                    log.debug("Request started: {}", requestPath);
                })
                .doFinally(signalType -> {
                    log.debug("Request completed: {} - {}", requestPath, signalType);
                    MDC.remove(CORRELATION_ID_KEY);
                });
    }

    private String extractOrGenerateCorrelationId(ServerHttpRequest request) {
        String correlationId = request.getHeaders().getFirst(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = request.getHeaders().getFirst(REQUEST_ID_HEADER);
        }
        if (correlationId == null || correlationId.isBlank()) {
            return UUID.randomUUID().toString();
        }
        String trimmed = correlationId.trim();
        return trimmed.length() > MAX_CORRELATION_ID_LENGTH ? trimmed.substring(0, MAX_CORRELATION_ID_LENGTH) : trimmed;
    }

    /**
     * Correlation id of the current request from the Reactor context.
     */
    public static Mono<String> getCorrelationId() {
        return Mono.deferContextual(ctx ->
                Mono.just(ctx.getOrDefault(CORRELATION_ID_KEY, "unknown")));
    }
}
