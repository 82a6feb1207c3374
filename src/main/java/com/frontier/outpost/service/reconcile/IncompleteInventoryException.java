package com.frontier.outpost.service.reconcile;

import com.frontier.outpost.model.ItemKey;

/**
 * The target holds more items than one listing returns, so whether it already
 * holds a given item cannot be decided.
 */
class IncompleteInventoryException extends RuntimeException {

    IncompleteInventoryException(String node, ItemKey key, int listLimit) {
        super("cannot tell whether " + node + " holds " + key + ": its " + key.category()
                + " listing exceeds the limit of " + listLimit + " items");
    }
}
