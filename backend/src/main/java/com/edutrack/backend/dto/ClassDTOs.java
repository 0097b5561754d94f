package com.edutrack.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public class ClassDTOs {

    public record CreateClassRequest(
        @NotNull String name,
        @NotNull String code, // unique per school, not enforced
        @JsonProperty("teacher_id") String teacherId,
        @JsonProperty("grade_level") String gradeLevel,
        @JsonProperty("student_ids") List<String> studentIds
    ) {
        public CreateClassRequest {
            if (studentIds == null) studentIds = List.of();
        }
    }

    public record UpdateClassRequest(
        String name,
        String code,
        @JsonProperty("teacher_id") String teacherId,
        @JsonProperty("grade_level") String gradeLevel,
        @JsonProperty("student_ids") List<String> studentIds
    ) {}
}
