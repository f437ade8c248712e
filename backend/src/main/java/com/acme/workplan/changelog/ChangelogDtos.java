package com.acme.workplan.changelog;

import com.acme.workplan.domain.entity.ChangeAction;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public class ChangelogDtos {
    public record EntryResponse(Long id, Long workItemId, String projectId, ChangeAction action, JsonNode details, Instant createdAt) {}
}
