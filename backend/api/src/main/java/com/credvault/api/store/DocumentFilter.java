package com.credvault.api.store;

import org.bson.conversions.Bson;

/**
 * A filter predicate over raw documents, rendered for the driver by {@link #toBson()}.
 */
public interface DocumentFilter {

    Bson toBson();

    /**
     * The empty filter, matching every document in a collection.
     */
    static DocumentFilter matchAll() {
        return MatchAllFilter.INSTANCE;
    }
}
