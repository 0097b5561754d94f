package com.edutrack.backend.store;

import java.util.List;
import java.util.Map;
import org.bson.Document;

/**
 * Generic access to named document collections. Filters are plain field-equality maps.
 */
public interface DocumentStore {

    String ID_FIELD = "_id";
    String TENANT_FIELD = "tenant_id";

    /**
     * Returns up to {@code limit} documents matching {@code filter} in natural order.
     * A limit of 0 means no limit.
     */
    List<Document> find(String collection, Map<String, Object> filter, int limit);

    /**
     * Inserts the document and returns the id the store assigned to it.
     */
    Object insertOne(String collection, Map<String, Object> document);

    /**
     * Replaces the fields of {@code patch} on the first document matching {@code filter}.
     *
     * @return the number of documents matched (0 or 1)
     */
    long updateOne(String collection, Map<String, Object> filter, Map<String, Object> patch);

    /**
     * @return the number of documents deleted (0 or 1)
     */
    long deleteOne(String collection, Map<String, Object> filter);

    List<String> listCollectionNames();

    String databaseName();
}
