package com.frontier.outpost.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;

/**
 * Maps any failure of an outpost call onto a {@link FailureClass}.
 *
 * This is the single place that decides retry eligibility:
 * <pre>
 *   connection refused/reset, timeout, DNS  → TRANSIENT
 *   HTTP 5xx                                → TRANSIENT
 *   HTTP 401 / 403                          → AUTHENTICATION
 *   HTTP 404                                → NOT_FOUND
 *   HTTP 409                                → CONFLICT
 *   other HTTP 4xx, unreadable body         → VALIDATION
 * </pre>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FailureClassifier {

    private static final int MAX_MESSAGE_LENGTH = 300;

    private final ObjectMapper objectMapper;

    public ClassifiedFailure classify(Throwable failure) {
        if (failure instanceof RestClientResponseException responseException) {
            return classifyStatus(responseException);
        }
        if (failure instanceof ResourceAccessException || failure instanceof IOException) {
            return new ClassifiedFailure(FailureClass.TRANSIENT, null, describe(failure), null, failure);
        }
        // RestClientException from body extraction, unexpected content type, etc.
        return new ClassifiedFailure(FailureClass.VALIDATION, null, describe(failure), null, failure);
    }

    private ClassifiedFailure classifyStatus(RestClientResponseException e) {
        int status = e.getStatusCode().value();
        String body = e.getResponseBodyAsString();
        String message = detailFrom(body, e.getStatusText());

        FailureClass failureClass;
        if (status >= 500) {
            failureClass = FailureClass.TRANSIENT;
        } else if (status == 401 || status == 403) {
            failureClass = FailureClass.AUTHENTICATION;
        } else if (status == 404) {
            failureClass = FailureClass.NOT_FOUND;
        } else if (status == 409) {
            failureClass = FailureClass.CONFLICT;
        } else {
            failureClass = FailureClass.VALIDATION;
        }

        String field = failureClass == FailureClass.VALIDATION ? fieldFrom(body) : null;
        return new ClassifiedFailure(failureClass, status, message, field, e);
    }

    /**
     * Nodes answer errors as {"detail": "..."} or, for validation errors,
     * {"detail": [{"loc": ["body", "quantity"], "msg": "..."}]}.
     */
    private String detailFrom(String body, String fallback) {
        JsonNode detail = parse(body).path("detail");
        if (detail.isTextual()) {
            return truncate(detail.asText());
        }
        if (detail.isArray() && detail.size() > 0) {
            return truncate(detail.get(0).path("msg").asText(fallback));
        }
        if (body != null && !body.isBlank()) {
            return truncate(body);
        }
        return fallback;
    }

    private String fieldFrom(String body) {
        JsonNode loc = parse(body).path("detail").path(0).path("loc");
        if (loc.isArray() && loc.size() > 0) {
            return loc.get(loc.size() - 1).asText();
        }
        return null;
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.missingNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
            return objectMapper.missingNode();
        }
    }

    private String describe(Throwable failure) {
        Throwable root = failure;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
        return truncate(root.getClass().getSimpleName() + ": " + message);
    }

    private String truncate(String text) {
        return text.length() > MAX_MESSAGE_LENGTH ? text.substring(0, MAX_MESSAGE_LENGTH) + "..." : text;
    }
}
