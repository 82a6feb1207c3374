package com.frontier.outpost.client;

/**
 * No outpost with the requested name is configured.
 */
public class UnknownOutpostException extends RuntimeException {

    public UnknownOutpostException(String name) {
        super("Unknown outpost: " + name);
    }
}
