package com.edutrack.backend.dto;

import com.edutrack.backend.domain.enums.StudentStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.List;

public class StudentDTOs {

    public record CreateStudentRequest(
        @JsonProperty("first_name") @NotNull String firstName,
        @JsonProperty("last_name") @NotNull String lastName,
        @Email @Size(min = 1) String email,
        String grade,
        LocalDate dob,
        @JsonProperty("parent_ids") List<String> parentIds,
        @JsonProperty("class_ids") List<String> classIds,
        StudentStatus status
    ) {
        public CreateStudentRequest {
            if (parentIds == null) parentIds = List.of();
            if (classIds == null) classIds = List.of();
            if (status == null) status = StudentStatus.ACTIVE;
        }
    }

    // Every field optional: only the ones sent are applied
    public record UpdateStudentRequest(
        @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName,
        @Email @Size(min = 1) String email,
        String grade,
        LocalDate dob,
        @JsonProperty("parent_ids") List<String> parentIds,
        @JsonProperty("class_ids") List<String> classIds,
        StudentStatus status
    ) {}
}
