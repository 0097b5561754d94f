package com.edutrack.backend.dto;

import com.edutrack.backend.domain.enums.LeadRole;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public class WaitlistDTOs {

    public record CreateLeadRequest(
        @NotBlank @Email String email,
        LeadRole role,
        String note
    ) {
        public CreateLeadRequest {
            if (role == null) role = LeadRole.SCHOOL_ADMIN;
        }
    }
}
