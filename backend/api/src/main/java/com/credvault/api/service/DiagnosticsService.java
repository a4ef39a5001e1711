package com.credvault.api.service;

import com.credvault.api.dto.DiagnosticsReport;
import com.credvault.api.store.DocumentStore;
import com.credvault.api.store.MongoConnectionProvider;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Reports store connectivity and configuration. Each probe catches its own failure
 * and writes it into the report; nothing is thrown to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiagnosticsService {

    static final String DATABASE_URL_VARIABLE = "DATABASE_URL";
    static final String DATABASE_NAME_VARIABLE = "DATABASE_NAME";
    static final int MAX_COLLECTIONS = 10;
    static final int MAX_ERROR_LENGTH = 50;

    private final MongoConnectionProvider connectionProvider;
    private final DocumentStore documentStore;
    private final Environment environment;

    public DiagnosticsReport runDiagnostics() {
        DiagnosticsReport report = new DiagnosticsReport();

        if (probeHandle(report)) {
            probeCollections(report);
        }

        report.setDatabaseUrl(variableStatus(DATABASE_URL_VARIABLE));
        report.setDatabaseName(variableStatus(DATABASE_NAME_VARIABLE));
        return report;
    }

    private boolean probeHandle(DiagnosticsReport report) {
        try {
            Optional<MongoTemplate> template = connectionProvider.template();
            if (template.isPresent()) {
                report.setDatabase("✅ Available");
                report.setConnectionStatus("Connected");
            } else {
                report.setDatabase("⚠️  Available but not initialized");
            }
            return template.isPresent();
        } catch (Exception e) {
            log.warn("Store handle probe failed: {}", e.getMessage());
            report.setDatabase("❌ Error: " + truncate(e));
            return false;
        }
    }

    private void probeCollections(DiagnosticsReport report) {
        try {
            report.setCollections(documentStore.listCollectionNames(MAX_COLLECTIONS));
            report.setDatabase("✅ Connected & Working");
        } catch (Exception e) {
            log.warn("Collection listing probe failed: {}", e.getMessage());
            report.setDatabase("⚠️  Connected but Error: " + truncate(e));
        }
    }

    private String variableStatus(String name) {
        try {
            return StringUtils.hasLength(environment.getProperty(name)) ? "✅ Set" : "❌ Not Set";
        } catch (Exception e) {
            log.warn("Could not read {}: {}", name, e.getMessage());
            return "❌ Not Set";
        }
    }

    static String truncate(Exception e) {
        String text = e.getMessage() != null ? e.getMessage() : e.toString();
        return text.length() <= MAX_ERROR_LENGTH ? text : text.substring(0, MAX_ERROR_LENGTH);
    }
}
