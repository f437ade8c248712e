package com.acme.workplan.identity;

import jakarta.validation.constraints.NotEmpty;

public class IdentityDtos {
    public record IdentifyRequest(@NotEmpty String descriptor) {}
    public record ProjectIdResponse(String projectId, String rawValue) {}
}
