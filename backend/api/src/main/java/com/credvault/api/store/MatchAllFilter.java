package com.credvault.api.store;

import org.bson.Document;
import org.bson.conversions.Bson;

enum MatchAllFilter implements DocumentFilter {
    INSTANCE;

    @Override
    public Bson toBson() {
        return new Document();
    }

    @Override
    public String toString() {
        return "MatchAll{}";
    }
}
