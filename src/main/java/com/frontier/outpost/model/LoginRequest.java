package com.frontier.outpost.model;

/**
 * Body of POST /auth/login.
 */
public record LoginRequest(String username, String password) {

    @Override
    public String toString() {
        return "LoginRequest[username=" + username + "]";
    }
}
