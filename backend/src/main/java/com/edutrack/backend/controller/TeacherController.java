package com.edutrack.backend.controller;

import com.edutrack.backend.config.EduTrackProperties;
import com.edutrack.backend.core.tenant.TenantContext;
import com.edutrack.backend.domain.SchoolCollection;
import com.edutrack.backend.dto.ResponseDTOs.CreatedResponse;
import com.edutrack.backend.dto.ResponseDTOs.UpdatedResponse;
import com.edutrack.backend.dto.TeacherDTOs.CreateTeacherRequest;
import com.edutrack.backend.dto.TeacherDTOs.UpdateTeacherRequest;
import com.edutrack.backend.service.TenantDocumentService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/teachers")
@RequiredArgsConstructor
public class TeacherController {

    private final TenantDocumentService documentService;
    private final EduTrackProperties properties;

    @GetMapping
    public List<Map<String, Object>> list(@RequestParam(required = false) Integer limit) {
        int effectiveLimit = limit != null ? limit : properties.defaultListLimit();
        return documentService.list(SchoolCollection.TEACHER, TenantContext.requireCurrentTenant(), effectiveLimit);
    }

    @PostMapping
    public CreatedResponse create(@Valid @RequestBody CreateTeacherRequest request) {
        String id = documentService.create(SchoolCollection.TEACHER, TenantContext.requireCurrentTenant(), request);
        return new CreatedResponse(id, "Teacher created");
    }

    @PutMapping("/{id}")
    public UpdatedResponse update(@PathVariable String id, @Valid @RequestBody UpdateTeacherRequest request) {
        documentService.update(SchoolCollection.TEACHER, TenantContext.requireCurrentTenant(), id, request);
        return new UpdatedResponse(id, true);
    }
}
