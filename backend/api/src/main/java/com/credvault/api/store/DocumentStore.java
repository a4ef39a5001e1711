package com.credvault.api.store;

import java.util.List;
import java.util.Map;
import org.bson.Document;

/**
 * Gateway to the document database. Failures surface as
 * {@link com.credvault.api.exception.StoreException}.
 */
public interface DocumentStore {

    /**
     * Inserts one record and returns the identifier the store assigned to it.
     */
    String createDocument(String collection, Map<String, Object> record);

    /**
     * Returns every raw document of the collection matching the filter, in natural order.
     */
    List<Document> getDocuments(String collection, DocumentFilter filter);

    List<String> listCollectionNames(int limit);
}
