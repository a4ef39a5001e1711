package com.credvault.api.service;

import com.credvault.api.dto.Credential;
import com.credvault.api.dto.CredentialOut;
import com.credvault.api.store.DocumentFilter;
import com.credvault.api.store.DocumentStore;
import com.credvault.api.store.SubstringFilter;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialService {

    static final String COLLECTION = "credential";

    private final DocumentStore documentStore;
    private final CredentialMapper credentialMapper;

    public String createCredential(Credential credential) {
        String id = documentStore.createDocument(COLLECTION, credential.toRecord());
        log.info("Created credential with id={}", id);
        return id;
    }

    /**
     * Lists all credentials, or those whose title or username contains {@code q}
     * ignoring case when {@code q} is non-empty.
     */
    public List<CredentialOut> listCredentials(String q) {
        DocumentFilter filter = searchFilter(q);
        List<Document> docs = documentStore.getDocuments(COLLECTION, filter);
        log.info("Credential search q='{}' matched {} documents", q, docs.size());

        return docs.stream()
                .map(credentialMapper::toOut)
                .collect(Collectors.toList());
    }

    static DocumentFilter searchFilter(String q) {
        if (q == null || q.isEmpty()) {
            return DocumentFilter.matchAll();
        }
        return SubstringFilter.anyOf(q, "title", "username");
    }
}
