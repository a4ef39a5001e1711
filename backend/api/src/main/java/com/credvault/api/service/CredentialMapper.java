package com.credvault.api.service;

import com.credvault.api.dto.CredentialOut;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Date;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Component;

/**
 * Maps raw credential documents to {@link CredentialOut}. Missing text fields become
 * empty strings, missing optional fields and undecodable timestamps become null.
 */
@Component
@Slf4j
public class CredentialMapper {

    public CredentialOut toOut(Document doc) {
        return CredentialOut.builder()
                .id(idToText(doc.get("_id")))
                .title(textOrEmpty(doc.get("title")))
                .username(textOrEmpty(doc.get("username")))
                .password(textOrEmpty(doc.get("password")))
                .url(textOrNull(doc.get("url")))
                .note(textOrNull(doc.get("note")))
                .createdAt(isoTimestamp(doc, "created_at"))
                .updatedAt(isoTimestamp(doc, "updated_at"))
                .build();
    }

    private String idToText(Object id) {
        if (id instanceof ObjectId objectId) {
            return objectId.toHexString();
        }
        return String.valueOf(id);
    }

    private String textOrEmpty(Object value) {
        return value == null ? "" : value.toString();
    }

    private String textOrNull(Object value) {
        return value == null ? null : value.toString();
    }

    private String isoTimestamp(Document doc, String field) {
        Object value = doc.get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof Date date) {
            return date.toInstant().toString();
        }
        if (value instanceof Instant instant) {
            return instant.toString();
        }
        if (value instanceof String text) {
            try {
                return Instant.parse(text).toString();
            } catch (DateTimeParseException e) {
                log.debug("Ignoring undecodable {} '{}' on document {}", field, text, doc.get("_id"));
                return null;
            }
        }
        log.debug("Ignoring {} of type {} on document {}", field, value.getClass().getSimpleName(), doc.get("_id"));
        return null;
    }
}
