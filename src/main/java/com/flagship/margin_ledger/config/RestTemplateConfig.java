package com.flagship.margin_ledger.config;

import com.flagship.margin_ledger.external.ExternalLedgerProperties;
import com.flagship.margin_ledger.observability.CorrelationContext;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * RestTemplate for the external ledger: base URL, bearer API key, timeouts,
 * correlation id propagation and call metrics.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class RestTemplateConfig {

    private final MeterRegistry meterRegistry;

    @Bean
    public RestTemplate externalLedgerRestTemplate(RestTemplateBuilder builder, ExternalLedgerProperties properties) {
        RestTemplateBuilder configured = builder
                .rootUri(properties.getBaseUrl())
                .setConnectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(properties.getReadTimeoutMs()))
                .additionalInterceptors(correlationIdInterceptor(), metricsInterceptor());
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            configured = configured.defaultHeader("Authorization", "Bearer " + properties.getApiKey());
        }

        log.info("External ledger client configured: baseUrl={}, connectTimeout={}ms, readTimeout={}ms",
                properties.getBaseUrl(), properties.getConnectTimeoutMs(), properties.getReadTimeoutMs());
        return configured.build();
    }

    private ClientHttpRequestInterceptor correlationIdInterceptor() {
        return (request, body, execution) -> {
            request.getHeaders().set(CorrelationContext.CORRELATION_ID_HEADER, CorrelationContext.getCorrelationId());
            return execution.execute(request, body);
        };
    }

    private ClientHttpRequestInterceptor metricsInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            try {
                ClientHttpResponse response = execution.execute(request, body);
                meterRegistry.counter("external_ledger.requests",
                        "method", request.getMethod().name(),
                        "status", String.valueOf(response.getStatusCode().value())
                ).increment();
                return response;
            } catch (Exception e) {
                meterRegistry.counter("external_ledger.requests.errors",
                        "method", request.getMethod().name(),
                        "exception", e.getClass().getSimpleName()
                ).increment();
                throw e;
            } finally {
                meterRegistry.timer("external_ledger.request.duration", "method", request.getMethod().name())
                        .record(Duration.ofMillis(System.currentTimeMillis() - startTime));
            }
        };
    }
}
