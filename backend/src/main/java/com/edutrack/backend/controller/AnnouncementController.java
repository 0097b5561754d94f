package com.edutrack.backend.controller;

import com.edutrack.backend.config.EduTrackProperties;
import com.edutrack.backend.core.tenant.TenantContext;
import com.edutrack.backend.domain.SchoolCollection;
import com.edutrack.backend.dto.AnnouncementDTOs.CreateAnnouncementRequest;
import com.edutrack.backend.dto.ResponseDTOs.CreatedResponse;
import com.edutrack.backend.service.TenantDocumentService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/announcements")
@RequiredArgsConstructor
public class AnnouncementController {

    private final TenantDocumentService documentService;
    private final EduTrackProperties properties;

    // Smaller default page than the other lists
    @GetMapping
    public List<Map<String, Object>> list(@RequestParam(required = false) Integer limit) {
        int effectiveLimit = limit != null ? limit : properties.announcementListLimit();
        return documentService.list(SchoolCollection.ANNOUNCEMENT, TenantContext.requireCurrentTenant(), effectiveLimit);
    }

    @PostMapping
    public CreatedResponse create(@Valid @RequestBody CreateAnnouncementRequest request) {
        String id = documentService.create(SchoolCollection.ANNOUNCEMENT, TenantContext.requireCurrentTenant(), request);
        return new CreatedResponse(id, "Announcement created");
    }
}
