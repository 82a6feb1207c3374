package com.frontier.outpost.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.frontier.outpost.client.FailureClassifier;
import com.frontier.outpost.client.ResilientRequestExecutor;
import com.frontier.outpost.client.RetryPolicy;
import com.frontier.outpost.client.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Wiring of the outpost HTTP stack: RestTemplate with per-attempt timeouts,
 * retry policies and the resilient executor.
 */
@Configuration
@Slf4j
public class ClientConfig {

    // ═══════════════════════════════════════════════════════════════
    // HTTP SETTINGS
    // ═══════════════════════════════════════════════════════════════

    @Value("${app.http.connect-timeout-ms:3000}")
    private long connectTimeoutMs;

    @Value("${app.http.read-timeout-ms:10000}")
    private long readTimeoutMs;

    // ═══════════════════════════════════════════════════════════════
    // RETRY SETTINGS
    // ═══════════════════════════════════════════════════════════════

    @Value("${app.retry.max-retries:3}")
    private int maxRetries;

    @Value("${app.retry.backoff-base-ms:1000}")
    private long backoffBaseMs;

    @Value("${app.retry.backoff-factor:2.0}")
    private double backoffFactor;

    @Value("${app.retry.max-delay-ms:30000}")
    private long maxDelayMs;

    @Value("${app.retry.create-max-retries:0}")
    private int createMaxRetries;

    @Bean
    @ConfigurationProperties("app.outposts")
    public OutpostProperties outpostProperties() {
        return new OutpostProperties();
    }

    /**
     * Every attempt is bounded by these timeouts independently of the backoff,
     * so a slow node shows up as a timeout rather than hanging a sync.
     */
    @Bean
    public RestTemplate outpostRestTemplate(RestTemplateBuilder builder, ObjectMapper objectMapper) {
        log.info("Creating outpost RestTemplate: connectTimeout={}ms, readTimeout={}ms", connectTimeoutMs, readTimeoutMs);
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .messageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
                .build();
    }

    /**
     * Policy for idempotent calls (reads, updates, deletes, export, login).
     */
    @Bean("readRetryPolicy")
    public RetryPolicy readRetryPolicy() {
        RetryPolicy policy = new RetryPolicy(maxRetries, Duration.ofMillis(backoffBaseMs), backoffFactor,
                Duration.ofMillis(maxDelayMs));
        log.info("Read retry policy: {}", policy);
        return policy;
    }

    /**
     * Policy for non-idempotent calls (create, bulk import). Zero retries unless configured.
     */
    @Bean("writeRetryPolicy")
    public RetryPolicy writeRetryPolicy(@Qualifier("readRetryPolicy") RetryPolicy readRetryPolicy) {
        RetryPolicy policy = readRetryPolicy.withMaxRetries(createMaxRetries);
        log.info("Write retry policy: {}", policy);
        return policy;
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResilientRequestExecutor resilientRequestExecutor(RestTemplate outpostRestTemplate,
                                                             FailureClassifier failureClassifier,
                                                             Sleeper sleeper,
                                                             AppMetrics metrics) {
        return new ResilientRequestExecutor(outpostRestTemplate, failureClassifier, sleeper, metrics);
    }
}
