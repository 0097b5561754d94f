package com.edutrack.backend.service;

import com.edutrack.backend.core.id.IdentifierCodec;
import com.edutrack.backend.core.web.ResponseShaper;
import com.edutrack.backend.domain.SchoolCollection;
import com.edutrack.backend.exception.NotFoundException;
import com.edutrack.backend.exception.ValidationException;
import com.edutrack.backend.store.DocumentStore;
import com.edutrack.backend.store.StoreGuard;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Service;

/**
 * List, create, update and delete for any tenant-scoped collection. Every store call carries the
 * tenant in its filter, so a record of one tenant can never be read or changed through another.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TenantDocumentService {

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {};

    private final DocumentStore documentStore;
    private final IdentifierCodec identifierCodec;
    private final ResponseShaper responseShaper;
    private final ObjectMapper objectMapper;

    public List<Map<String, Object>> list(SchoolCollection collection, String tenantId, int limit) {
        if (limit < 0) {
            throw new ValidationException("limit must not be negative");
        }
        Map<String, Object> filter = Map.of(DocumentStore.TENANT_FIELD, tenantId);
        List<Document> documents = StoreGuard.call(
                () -> documentStore.find(collection.collectionName(), filter, limit));
        return responseShaper.shapeAll(documents);
    }

    /**
     * Stores the payload under the given tenant and returns the new id. A {@code tenant_id} sent
     * by the client is overwritten.
     */
    public String create(SchoolCollection collection, String tenantId, Object payload) {
        Map<String, Object> document = toDocument(payload);
        document.remove(DocumentStore.ID_FIELD);
        document.put(DocumentStore.TENANT_FIELD, tenantId);

        Object nativeId = StoreGuard.call(() -> documentStore.insertOne(collection.collectionName(), document));
        String id = identifierCodec.encode(nativeId);
        log.info("Created {} {} for tenant {}", collection.collectionName(), id, tenantId);
        return id;
    }

    /**
     * Applies the non-null fields of the payload to the record, leaving every other field as it
     * was. Fails with {@link NotFoundException} when the record does not exist for this tenant.
     */
    public String update(SchoolCollection collection, String tenantId, String id, Object payload) {
        ObjectId objectId = identifierCodec.decode(id);
        Map<String, Object> patch = toDocument(payload);
        patch.values().removeIf(Objects::isNull);
        patch.remove(DocumentStore.ID_FIELD);
        patch.remove(DocumentStore.TENANT_FIELD);

        Map<String, Object> filter = scopedFilter(objectId, tenantId);
        long matched;
        if (patch.isEmpty()) {
            // nothing to write, but the caller still learns whether the record exists
            matched = StoreGuard.call(() -> documentStore.find(collection.collectionName(), filter, 1)).size();
        } else {
            matched = StoreGuard.call(() -> documentStore.updateOne(collection.collectionName(), filter, patch));
        }
        if (matched == 0) {
            throw new NotFoundException(collection.label() + " not found");
        }
        log.info("Updated {} {} for tenant {}: {}", collection.collectionName(), id, tenantId, patch.keySet());
        return id;
    }

    public String delete(SchoolCollection collection, String tenantId, String id) {
        ObjectId objectId = identifierCodec.decode(id);
        Map<String, Object> filter = scopedFilter(objectId, tenantId);

        long deleted = StoreGuard.call(() -> documentStore.deleteOne(collection.collectionName(), filter));
        if (deleted == 0) {
            throw new NotFoundException(collection.label() + " not found");
        }
        log.info("Deleted {} {} for tenant {}", collection.collectionName(), id, tenantId);
        return id;
    }

    Map<String, Object> toDocument(Object payload) {
        return objectMapper.convertValue(payload, DOCUMENT_TYPE);
    }

    private static Map<String, Object> scopedFilter(ObjectId id, String tenantId) {
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put(DocumentStore.ID_FIELD, id);
        filter.put(DocumentStore.TENANT_FIELD, tenantId);
        return filter;
    }
}
