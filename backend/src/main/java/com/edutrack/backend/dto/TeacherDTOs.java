package com.edutrack.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public class TeacherDTOs {

    public record CreateTeacherRequest(
        @JsonProperty("first_name") @NotNull String firstName,
        @JsonProperty("last_name") @NotNull String lastName,
        @NotBlank @Email String email,
        String subject,
        @JsonProperty("is_admin") Boolean isAdmin
    ) {
        public CreateTeacherRequest {
            if (isAdmin == null) isAdmin = false;
        }
    }

    public record UpdateTeacherRequest(
        @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName,
        @Email @Size(min = 1) String email,
        String subject,
        @JsonProperty("is_admin") Boolean isAdmin
    ) {}
}
