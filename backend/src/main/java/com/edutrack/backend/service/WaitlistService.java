package com.edutrack.backend.service;

import com.edutrack.backend.core.id.IdentifierCodec;
import com.edutrack.backend.domain.SchoolCollection;
import com.edutrack.backend.dto.WaitlistDTOs.CreateLeadRequest;
import com.edutrack.backend.store.DocumentStore;
import com.edutrack.backend.store.StoreGuard;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Marketing sign-ups. Leads arrive before any school exists, so they carry no tenant.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WaitlistService {

    private final DocumentStore documentStore;
    private final IdentifierCodec identifierCodec;
    private final ObjectMapper objectMapper;

    public String captureLead(CreateLeadRequest request) {
        LinkedHashMap<String, Object> document = objectMapper.convertValue(request, new TypeReference<LinkedHashMap<String, Object>>() {});
        Object nativeId = StoreGuard.call(
                () -> documentStore.insertOne(SchoolCollection.WAITLIST_LEAD.collectionName(), document));
        String id = identifierCodec.encode(nativeId);
        log.info("Captured waitlist lead {} ({})", id, request.role().value());
        return id;
    }
}
