package com.edutrack.backend.controller;

import com.edutrack.backend.config.EduTrackProperties;
import com.edutrack.backend.core.tenant.TenantContext;
import com.edutrack.backend.domain.SchoolCollection;
import com.edutrack.backend.dto.ResponseDTOs.CreatedResponse;
import com.edutrack.backend.dto.ResponseDTOs.DeletedResponse;
import com.edutrack.backend.dto.ResponseDTOs.UpdatedResponse;
import com.edutrack.backend.dto.StudentDTOs.CreateStudentRequest;
import com.edutrack.backend.dto.StudentDTOs.UpdateStudentRequest;
import com.edutrack.backend.service.TenantDocumentService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/students")
@RequiredArgsConstructor
public class StudentController {

    private final TenantDocumentService documentService;
    private final EduTrackProperties properties;

    @GetMapping
    public List<Map<String, Object>> list(@RequestParam(required = false) Integer limit) {
        int effectiveLimit = limit != null ? limit : properties.defaultListLimit();
        return documentService.list(SchoolCollection.STUDENT, TenantContext.requireCurrentTenant(), effectiveLimit);
    }

    @PostMapping
    public CreatedResponse create(@Valid @RequestBody CreateStudentRequest request) {
        String id = documentService.create(SchoolCollection.STUDENT, TenantContext.requireCurrentTenant(), request);
        return new CreatedResponse(id, "Student created");
    }

    @PutMapping("/{id}")
    public UpdatedResponse update(@PathVariable String id, @Valid @RequestBody UpdateStudentRequest request) {
        documentService.update(SchoolCollection.STUDENT, TenantContext.requireCurrentTenant(), id, request);
        return new UpdatedResponse(id, true);
    }

    @DeleteMapping("/{id}")
    public DeletedResponse delete(@PathVariable String id) {
        documentService.delete(SchoolCollection.STUDENT, TenantContext.requireCurrentTenant(), id);
        return new DeletedResponse(id, true);
    }
}
