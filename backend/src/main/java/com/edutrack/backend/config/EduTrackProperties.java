package com.edutrack.backend.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the {@code edutrack.*} prefix.
 *
 * @param defaultListLimit page size for list endpoints when the client sends no {@code limit}
 * @param announcementListLimit page size for {@code GET /announcements}
 * @param corsAllowedOrigins origin patterns accepted by the CORS configuration
 */
@ConfigurationProperties(prefix = "edutrack")
public record EduTrackProperties(
        int defaultListLimit, int announcementListLimit, List<String> corsAllowedOrigins) {

    public EduTrackProperties {
        if (defaultListLimit <= 0) {
            defaultListLimit = 50;
        }
        if (announcementListLimit <= 0) {
            announcementListLimit = 20;
        }
        if (corsAllowedOrigins == null || corsAllowedOrigins.isEmpty()) {
            corsAllowedOrigins = List.of("*");
        }
    }
}
