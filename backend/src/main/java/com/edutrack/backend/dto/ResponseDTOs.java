package com.edutrack.backend.dto;

public class ResponseDTOs {

    public record CreatedResponse(String id, String message) {}

    public record UpdatedResponse(String id, boolean updated) {}

    public record DeletedResponse(String id, boolean deleted) {}

    public record MessageResponse(String message) {}
}
