package com.edutrack.backend.controller;

import com.edutrack.backend.dto.ResponseDTOs.CreatedResponse;
import com.edutrack.backend.dto.ResponseDTOs.MessageResponse;
import com.edutrack.backend.dto.WaitlistDTOs.CreateLeadRequest;
import com.edutrack.backend.service.DiagnosticsService;
import com.edutrack.backend.service.WaitlistService;
import jakarta.validation.Valid;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/**
 * Endpoints that need no tenant: liveness, store diagnostics and the public waitlist.
 */
@RestController
@RequiredArgsConstructor
public class SystemController {

    private final DiagnosticsService diagnosticsService;
    private final WaitlistService waitlistService;

    @GetMapping("/")
    public MessageResponse root() {
        return new MessageResponse("EduTrack backend is running");
    }

    @GetMapping("/test")
    public Map<String, Object> testDatabase() {
        return diagnosticsService.report();
    }

    @PostMapping("/waitlist")
    public CreatedResponse joinWaitlist(@Valid @RequestBody CreateLeadRequest request) {
        String id = waitlistService.captureLead(request);
        return new CreatedResponse(id, "Lead captured");
    }
}
