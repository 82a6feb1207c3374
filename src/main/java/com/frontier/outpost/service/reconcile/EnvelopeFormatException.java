package com.frontier.outpost.service.reconcile;

import lombok.Getter;

/**
 * The envelope cannot be imported as a whole; nothing was written to the target.
 */
@Getter
public class EnvelopeFormatException extends RuntimeException {

    /** Offending field, e.g. {@code items[2].quantity}; null when the envelope itself is missing. */
    private final String field;

    public EnvelopeFormatException(String field, String message) {
        super(field != null ? field + ": " + message : message);
        this.field = field;
    }
}
