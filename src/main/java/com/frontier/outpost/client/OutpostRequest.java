package com.frontier.outpost.client;

import org.springframework.http.HttpMethod;

import java.util.Map;

/**
 * One logical call against an outpost's REST surface.
 *
 * @param operation     short name used in logs and errors
 * @param authenticated the endpoint is protected; a valid token is required
 * @param idempotent    safe to retry; non-idempotent calls use the write retry policy
 */
public record OutpostRequest(
    String operation,
    HttpMethod method,
    String path,
    Map<String, Object> queryParams,
    Object body,
    boolean authenticated,
    boolean idempotent
) {

    public OutpostRequest {
        queryParams = queryParams != null ? Map.copyOf(queryParams) : Map.of();
    }

    public static OutpostRequest read(String operation, String path, Map<String, Object> queryParams, boolean authenticated) {
        return new OutpostRequest(operation, HttpMethod.GET, path, queryParams, null, authenticated, true);
    }

    public static OutpostRequest read(String operation, String path) {
        return read(operation, path, Map.of(), false);
    }

    public static OutpostRequest write(String operation, HttpMethod method, String path, Object body, boolean idempotent) {
        return new OutpostRequest(operation, method, path, Map.of(), body, true, idempotent);
    }
}
