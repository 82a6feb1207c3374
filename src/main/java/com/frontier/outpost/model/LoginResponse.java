package com.frontier.outpost.model;

/**
 * Response of POST /auth/login.
 */
public record LoginResponse(
    String accessToken,
    String tokenType,
    Long expiresIn
) {

    @Override
    public String toString() {
        return "LoginResponse[tokenType=" + tokenType + ", expiresIn=" + expiresIn + "]";
    }
}
