package com.acme.workplan.changelog;

import com.acme.workplan.common.InvalidArgumentException;
import com.acme.workplan.common.NotFoundException;
import com.acme.workplan.common.StorageFailureException;
import com.acme.workplan.config.WorkPlanProperties;
import com.acme.workplan.domain.entity.ChangeAction;
import com.acme.workplan.domain.entity.ChangelogEntry;
import com.acme.workplan.domain.repo.ChangelogEntryRepository;
import com.acme.workplan.domain.repo.WorkItemRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@Service
public class ChangelogService {
    private static final Logger log = LoggerFactory.getLogger(ChangelogService.class);

    private final ChangelogEntryRepository changelogRepo;
    private final WorkItemRepository itemRepo;
    private final ObjectMapper objectMapper;
    private final WorkPlanProperties properties;

    public ChangelogService(ChangelogEntryRepository changelogRepo, WorkItemRepository itemRepo, ObjectMapper objectMapper, WorkPlanProperties properties) {
        this.changelogRepo = changelogRepo;
        this.itemRepo = itemRepo;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public ChangelogEntry append(long workItemId, String projectId, ChangeAction action, Map<String, Object> details) {
        String json;
        try {
            json = objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new StorageFailureException("Could not serialize changelog details for item " + workItemId, e);
        }
        ChangelogEntry entry = changelogRepo.save(new ChangelogEntry(workItemId, projectId, action, json));
        log.debug("Logged {} for work item {} in project {}", action.wireName(), workItemId, projectId);
        return entry;
    }

    @Transactional(readOnly = true)
    public List<ChangelogDtos.EntryResponse> listForItem(String projectId, long workItemId) {
        if (itemRepo.findByIdAndProjectId(workItemId, projectId).isEmpty()) {
            throw NotFoundException.workItem(workItemId, projectId);
        }
        return changelogRepo.findByWorkItemIdAndProjectIdOrderByCreatedAtAscIdAsc(workItemId, projectId).stream()
                .map(this::toResponse)
                .toList();
    }

    /**
     * Lists a project's entries oldest first. With a limit, the most recent {@code limit}
     * entries are returned, still oldest first.
     */
    @Transactional(readOnly = true)
    public List<ChangelogDtos.EntryResponse> listForProject(String projectId, Integer limit) {
        if (limit == null) {
            return changelogRepo.findByProjectIdOrderByCreatedAtAscIdAsc(projectId).stream().map(this::toResponse).toList();
        }
        if (limit <= 0) throw new InvalidArgumentException("limit must be positive");
        int capped = Math.min(limit, properties.changelogMaxLimit());
        List<ChangelogEntry> latest = new ArrayList<>(
                changelogRepo.findByProjectIdOrderByCreatedAtDescIdDesc(projectId, PageRequest.of(0, capped)));
        Collections.reverse(latest);
        return latest.stream().map(this::toResponse).toList();
    }

    private ChangelogDtos.EntryResponse toResponse(ChangelogEntry entry) {
        JsonNode details;
        try {
            details = objectMapper.readTree(entry.getDetails());
        } catch (JsonProcessingException e) {
            details = objectMapper.getNodeFactory().textNode(entry.getDetails());
        }
        return new ChangelogDtos.EntryResponse(entry.getId(), entry.getWorkItemId(), entry.getProjectId(),
                entry.getAction(), details, entry.getCreatedAt());
    }
}
