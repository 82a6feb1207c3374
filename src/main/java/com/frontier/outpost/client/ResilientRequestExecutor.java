package com.frontier.outpost.client;

import com.frontier.outpost.config.AppMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Duration;

/**
 * Executes one logical HTTP request with classification-aware retry.
 *
 * Retryable failures (see {@link FailureClassifier}) are retried up to
 * {@code policy.maxRetries()} times with the policy's deterministic backoff;
 * anything else is surfaced after the first attempt. The per-attempt timeout
 * lives on the {@link RestTemplate}'s request factory, not here.
 */
@Slf4j
public class ResilientRequestExecutor {

    private final RestTemplate restTemplate;
    private final FailureClassifier classifier;
    private final Sleeper sleeper;
    private final AppMetrics metrics;

    public ResilientRequestExecutor(RestTemplate restTemplate, FailureClassifier classifier,
                                    Sleeper sleeper, AppMetrics metrics) {
        this.restTemplate = restTemplate;
        this.classifier = classifier;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    /**
     * @throws OutpostException           terminal failure, or the last retryable failure once the budget is spent
     * @throws OperationCancelledException the thread was interrupted before an attempt or during backoff
     */
    public <T> ResponseEntity<T> execute(String node, String operation, HttpMethod method, URI uri,
                                         HttpEntity<?> entity, ParameterizedTypeReference<T> responseType,
                                         RetryPolicy policy) {
        int maxAttempts = policy.maxAttempts();
        for (int attemptIndex = 0; ; attemptIndex++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new OperationCancelledException(operation + " on " + node + " cancelled before attempt " + (attemptIndex + 1));
            }
            int attempt = attemptIndex + 1;
            metrics.incrementHttpAttempts(node);
            try {
                ResponseEntity<T> response = restTemplate.exchange(uri, method, entity, responseType);
                if (attemptIndex > 0) {
                    log.info("{} on {} succeeded on attempt {}/{}", operation, node, attempt, maxAttempts);
                }
                return response;
            } catch (RestClientException e) {
                ClassifiedFailure failure = classifier.classify(e);

                if (!failure.retryable()) {
                    log.warn("{} on {} failed with {} (attempt {}/{}), not retrying: {}",
                            operation, node, failure.failureClass(), attempt, maxAttempts, failure.message());
                    throw failure.toException(node, operation, attempt);
                }
                if (attempt >= maxAttempts) {
                    log.error("{} on {} failed after {} attempts: {}", operation, node, attempt, failure.message());
                    throw failure.toException(node, operation, attempt);
                }

                Duration delay = policy.delayFor(attemptIndex);
                log.warn("{} on {} failed (attempt {}/{}), retrying in {}ms: {}",
                        operation, node, attempt, maxAttempts, delay.toMillis(), failure.message());
                metrics.incrementHttpRetries(node);
                pause(node, operation, delay);
            }
        }
    }

    private void pause(String node, String operation, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(operation + " on " + node + " cancelled during backoff", ie);
        }
    }
}
