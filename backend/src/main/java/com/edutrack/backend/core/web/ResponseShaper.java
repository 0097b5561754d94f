package com.edutrack.backend.core.web;

import com.edutrack.backend.core.id.IdentifierCodec;
import com.edutrack.backend.store.DocumentStore;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns stored documents into response payloads: the internal {@code _id} becomes a string
 * {@code id} placed first, and the {@code tenant_id} scoping field is dropped. Shaping an already
 * shaped payload gives the same payload back.
 */
@Component
@RequiredArgsConstructor
public class ResponseShaper {

    private final IdentifierCodec identifierCodec;

    public Map<String, Object> shape(Map<String, Object> document) {
        if (document == null || document.isEmpty()) {
            return document;
        }
        Map<String, Object> shaped = new LinkedHashMap<>();
        if (document.containsKey(DocumentStore.ID_FIELD)) {
            shaped.put("id", identifierCodec.encode(document.get(DocumentStore.ID_FIELD)));
        } else if (document.containsKey("id")) {
            shaped.put("id", document.get("id"));
        }
        document.forEach((key, value) -> {
            if (!DocumentStore.ID_FIELD.equals(key) && !"id".equals(key)
                    && !DocumentStore.TENANT_FIELD.equals(key)) {
                shaped.put(key, value);
            }
        });
        return shaped;
    }

    public List<Map<String, Object>> shapeAll(List<? extends Map<String, Object>> documents) {
        if (documents == null) {
            return List.of();
        }
        return documents.stream().map(this::shape).collect(Collectors.toList());
    }
}
