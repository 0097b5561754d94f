package com.edutrack.backend.dto;

import com.edutrack.backend.domain.enums.EnrollmentStatus;
import com.edutrack.backend.domain.enums.ProgressMetric;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Payloads for the records that link students to parents and classes.
 */
public class FamilyDTOs {

    public record CreateParentRequest(
        @JsonProperty("first_name") @NotNull String firstName,
        @JsonProperty("last_name") @NotNull String lastName,
        @NotBlank @Email String email,
        String phone,
        @JsonProperty("student_ids") List<String> studentIds
    ) {
        public CreateParentRequest {
            if (studentIds == null) studentIds = List.of();
        }
    }

    public record CreateEnrollmentRequest(
        @JsonProperty("student_id") @NotNull String studentId,
        @JsonProperty("class_id") @NotNull String classId,
        EnrollmentStatus status
    ) {
        public CreateEnrollmentRequest {
            if (status == null) status = EnrollmentStatus.ENROLLED;
        }
    }

    public record CreateProgressRequest(
        @JsonProperty("student_id") @NotNull String studentId,
        @JsonProperty("class_id") String classId,
        ProgressMetric metric,
        String title,
        @DecimalMin("0") @DecimalMax("100") Double score, // percentage
        String notes
    ) {
        public CreateProgressRequest {
            if (metric == null) metric = ProgressMetric.ASSIGNMENT;
        }
    }
}
