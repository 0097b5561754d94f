package com.edutrack.backend.core.id;

import com.edutrack.backend.exception.InvalidIdentifierException;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Component;

/**
 * Translates between the public string ids and the store's native {@link ObjectId}.
 * Malformed ids are rejected here, before they can reach a query.
 */
@Component
public class IdentifierCodec {

    public ObjectId decode(String value) {
        if (value == null || !ObjectId.isValid(value)) {
            throw new InvalidIdentifierException(value);
        }
        return new ObjectId(value);
    }

    public String encode(Object nativeId) {
        if (nativeId == null) {
            return null;
        }
        if (nativeId instanceof ObjectId) {
            return ((ObjectId) nativeId).toHexString();
        }
        return nativeId.toString();
    }
}
