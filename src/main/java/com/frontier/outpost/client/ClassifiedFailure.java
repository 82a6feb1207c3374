package com.frontier.outpost.client;

/**
 * A failure tagged with its {@link FailureClass}.
 *
 * @param httpStatus status code when the node answered, null for transport failures
 * @param field      offending request field when the node reported one
 */
public record ClassifiedFailure(
    FailureClass failureClass,
    Integer httpStatus,
    String message,
    String field,
    Throwable cause
) {

    public boolean retryable() {
        return failureClass.isRetryable();
    }

    /**
     * Converts to the exception surfaced to callers, annotated with the attempt count.
     */
    public OutpostException toException(String node, String operation, int attempts) {
        String detail = String.format("%s on %s failed after %d attempt(s)%s: %s",
                operation, node, attempts,
                httpStatus != null ? " [HTTP " + httpStatus + "]" : "",
                message);
        return switch (failureClass) {
            case TRANSIENT -> new OutpostTransientException(node, attempts, detail, cause);
            case AUTHENTICATION -> new OutpostAuthenticationException(node, attempts, detail, cause);
            case NOT_FOUND -> new OutpostNotFoundException(node, attempts, detail, cause);
            case VALIDATION -> new OutpostValidationException(node, attempts, field, detail, cause);
            case CONFLICT -> new OutpostConflictException(node, attempts, detail, cause);
        };
    }
}
