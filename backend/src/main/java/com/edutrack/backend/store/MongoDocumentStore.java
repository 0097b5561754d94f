package com.edutrack.backend.store;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.result.InsertOneResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.bson.BsonValue;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MongoDocumentStore implements DocumentStore {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<Document> find(String collection, Map<String, Object> filter, int limit) {
        return collection(collection)
                .find(new Document(filter))
                .limit(limit)
                .into(new ArrayList<>());
    }

    @Override
    public Object insertOne(String collection, Map<String, Object> document) {
        Document toInsert = new Document(document);
        InsertOneResult result = collection(collection).insertOne(toInsert);
        // the driver sets _id on the inserted document when it generates one
        Object id = toInsert.get(ID_FIELD);
        if (id != null) {
            return id;
        }
        BsonValue inserted = result.getInsertedId();
        if (inserted == null) {
            return null;
        }
        return inserted.isObjectId() ? inserted.asObjectId().getValue() : inserted.toString();
    }

    @Override
    public long updateOne(String collection, Map<String, Object> filter, Map<String, Object> patch) {
        return collection(collection)
                .updateOne(new Document(filter), new Document("$set", new Document(patch)))
                .getMatchedCount();
    }

    @Override
    public long deleteOne(String collection, Map<String, Object> filter) {
        return collection(collection)
                .deleteOne(new Document(filter))
                .getDeletedCount();
    }

    @Override
    public List<String> listCollectionNames() {
        return mongoTemplate.getDb().listCollectionNames().into(new ArrayList<>());
    }

    @Override
    public String databaseName() {
        return mongoTemplate.getDb().getName();
    }

    private MongoCollection<Document> collection(String name) {
        return mongoTemplate.getCollection(name);
    }
}
