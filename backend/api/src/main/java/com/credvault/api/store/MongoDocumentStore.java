package com.credvault.api.store;

import com.credvault.api.exception.StoreException;
import com.mongodb.client.result.InsertOneResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.BsonValue;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class MongoDocumentStore implements DocumentStore {

    static final String CREATED_AT = "created_at";
    static final String UPDATED_AT = "updated_at";

    private final MongoConnectionProvider connectionProvider;

    // ============================================================
    // WRITES
    // ============================================================
    @Override
    public String createDocument(String collection, Map<String, Object> record) {
        MongoTemplate template = connectionProvider.requireTemplate();

        Document doc = new Document(record);
        Date now = Date.from(Instant.now());
        doc.put(CREATED_AT, now);
        doc.put(UPDATED_AT, now);

        try {
            InsertOneResult result = template.getCollection(collection).insertOne(doc);
            String id = idToText(result.getInsertedId());
            log.debug("Inserted into {} with _id={}", collection, id);
            return id;
        } catch (Exception e) {
            log.error("MongoDB insert error on {}: {}", collection, e.getMessage());
            throw StoreException.executionError(collection, e);
        }
    }

    // ============================================================
    // READS
    // ============================================================
    @Override
    public List<Document> getDocuments(String collection, DocumentFilter filter) {
        MongoTemplate template = connectionProvider.requireTemplate();

        try {
            return template.getCollection(collection)
                    .find(filter.toBson())
                    .into(new ArrayList<>());
        } catch (Exception e) {
            log.error("MongoDB find error on {} with {}: {}", collection, filter, e.getMessage());
            throw StoreException.executionError(collection, e);
        }
    }

    @Override
    public List<String> listCollectionNames(int limit) {
        MongoTemplate template = connectionProvider.requireTemplate();

        try {
            List<String> names = template.getDb().listCollectionNames().into(new ArrayList<>());
            return new ArrayList<>(names.subList(0, Math.min(limit, names.size())));
        } catch (Exception e) {
            throw StoreException.executionError(null, e);
        }
    }

    private String idToText(BsonValue id) {
        if (id == null) {
            throw new IllegalStateException("Store did not report an inserted id");
        }
        if (id.isObjectId()) {
            return id.asObjectId().getValue().toHexString();
        }
        if (id.isString()) {
            return id.asString().getValue();
        }
        return id.toString();
    }
}
