package com.frontier.outpost.model;

import java.time.Instant;

/**
 * Bearer token issued by one outpost. Never persisted.
 */
public record AuthToken(
    String value,
    Instant issuedAt,
    Instant expiresAt,
    String principal
) {

    public boolean isValidAt(Instant now) {
        return now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "AuthToken[principal=" + principal + ", issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "]";
    }
}
