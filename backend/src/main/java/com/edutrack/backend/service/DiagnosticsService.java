package com.edutrack.backend.service;

import com.edutrack.backend.store.DocumentStore;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

/**
 * Store connectivity report for {@code GET /test}. Never throws: every failure ends up as text in
 * the {@code database} field.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiagnosticsService {

    static final int MAX_COLLECTIONS = 10;
    static final int MAX_ERROR_LENGTH = 50;

    private final DocumentStore documentStore;
    private final Environment environment;

    public Map<String, Object> report() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("backend", "✅ Running");
        response.put("database", "❌ Not Available");
        response.put("database_url", null);
        response.put("database_name", null);
        response.put("connection_status", "Not Connected");
        response.put("collections", List.of());

        try {
            String databaseName = documentStore.databaseName();
            log.debug("Diagnostics against database {}", databaseName);
            response.put("database", "✅ Available");
            response.put("connection_status", "Connected");
            try {
                List<String> collections = documentStore.listCollectionNames();
                response.put("collections", collections.subList(0, Math.min(MAX_COLLECTIONS, collections.size())));
                response.put("database", "✅ Connected & Working");
            } catch (RuntimeException e) {
                log.warn("Store reachable but listing collections failed: {}", e.getMessage());
                response.put("database", "⚠️  Connected but Error: " + truncate(e.getMessage()));
            }
        } catch (RuntimeException e) {
            log.warn("Store unavailable: {}", e.getMessage());
            response.put("database", "❌ Error: " + truncate(e.getMessage()));
        }

        // reports whether the connection settings were supplied, never their values
        response.put("database_url", environment.containsProperty("DATABASE_URL") ? "✅ Set" : "❌ Not Set");
        response.put("database_name", environment.containsProperty("DATABASE_NAME") ? "✅ Set" : "❌ Not Set");
        return response;
    }

    private static String truncate(String message) {
        if (message == null) {
            return "";
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
