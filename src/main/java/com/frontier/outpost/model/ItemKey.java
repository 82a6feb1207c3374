package com.frontier.outpost.model;

/**
 * (name, category) pair identifying an item across outposts.
 */
public record ItemKey(String name, String category) {

    @Override
    public String toString() {
        return name + " (" + category + ")";
    }
}
