package com.edutrack.backend.controller;

import com.edutrack.backend.config.EduTrackProperties;
import com.edutrack.backend.core.tenant.TenantContext;
import com.edutrack.backend.domain.SchoolCollection;
import com.edutrack.backend.dto.FamilyDTOs.CreateEnrollmentRequest;
import com.edutrack.backend.dto.FamilyDTOs.CreateParentRequest;
import com.edutrack.backend.dto.FamilyDTOs.CreateProgressRequest;
import com.edutrack.backend.dto.ResponseDTOs.CreatedResponse;
import com.edutrack.backend.service.TenantDocumentService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
public class FamilyController {

    private final TenantDocumentService documentService;
    private final EduTrackProperties properties;

    // --- PARENTS ---
    @GetMapping("/parents")
    public List<Map<String, Object>> listParents(@RequestParam(required = false) Integer limit) {
        return list(SchoolCollection.PARENT, limit);
    }

    @PostMapping("/parents")
    public CreatedResponse createParent(@Valid @RequestBody CreateParentRequest request) {
        return create(SchoolCollection.PARENT, request);
    }

    // --- ENROLLMENTS ---
    @GetMapping("/enrollments")
    public List<Map<String, Object>> listEnrollments(@RequestParam(required = false) Integer limit) {
        return list(SchoolCollection.ENROLLMENT, limit);
    }

    @PostMapping("/enrollments")
    public CreatedResponse createEnrollment(@Valid @RequestBody CreateEnrollmentRequest request) {
        return create(SchoolCollection.ENROLLMENT, request);
    }

    // --- PROGRESS ---
    @GetMapping("/progress")
    public List<Map<String, Object>> listProgress(@RequestParam(required = false) Integer limit) {
        return list(SchoolCollection.PROGRESS, limit);
    }

    @PostMapping("/progress")
    public CreatedResponse createProgress(@Valid @RequestBody CreateProgressRequest request) {
        return create(SchoolCollection.PROGRESS, request);
    }

    private List<Map<String, Object>> list(SchoolCollection collection, Integer limit) {
        int effectiveLimit = limit != null ? limit : properties.defaultListLimit();
        return documentService.list(collection, TenantContext.requireCurrentTenant(), effectiveLimit);
    }

    private CreatedResponse create(SchoolCollection collection, Object request) {
        String id = documentService.create(collection, TenantContext.requireCurrentTenant(), request);
        return new CreatedResponse(id, collection.label() + " created");
    }
}
