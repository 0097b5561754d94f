package com.edutrack.backend.dto;

import com.edutrack.backend.domain.enums.Audience;
import jakarta.validation.constraints.NotNull;

public class AnnouncementDTOs {

    public record CreateAnnouncementRequest(
        @NotNull String title,
        @NotNull String body,
        Audience audience
    ) {
        public CreateAnnouncementRequest {
            if (audience == null) audience = Audience.ALL;
        }
    }
}
