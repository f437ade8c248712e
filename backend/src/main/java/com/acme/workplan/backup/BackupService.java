package com.acme.workplan.backup;

import com.acme.workplan.changelog.ChangelogService;
import com.acme.workplan.common.InvalidArgumentException;
import com.acme.workplan.common.WorkPlanException;
import com.acme.workplan.config.WorkPlanProperties;
import com.acme.workplan.domain.entity.WorkItemType;
import com.acme.workplan.domain.entity.WorkStatus;
import com.acme.workplan.workitem.FieldUpdate;
import com.acme.workplan.workitem.WorkItemDtos;
import com.acme.workplan.workitem.WorkItemService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class BackupService {
    private static final Logger log = LoggerFactory.getLogger(BackupService.class);
    static final String BACKUP_ENTRY = "backup.json";

    private final WorkItemService workItemService;
    private final ChangelogService changelogService;
    private final ObjectMapper objectMapper;
    private final WorkPlanProperties properties;

    public BackupService(WorkItemService workItemService, ChangelogService changelogService, ObjectMapper objectMapper, WorkPlanProperties properties) {
        this.workItemService = workItemService;
        this.changelogService = changelogService;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Transactional(readOnly = true)
    public void exportProject(String projectId, OutputStream outputStream) throws IOException {
        List<WorkItemDtos.ItemResponse> items = workItemService.listByProject(projectId);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("projectId", projectId);
        payload.put("exportedAt", Instant.now().toString());
        payload.put("items", items);
        payload.put("changelog", changelogService.listForProject(projectId, null));

        try (ZipArchiveOutputStream zip = new ZipArchiveOutputStream(outputStream)) {
            zip.putArchiveEntry(new ZipArchiveEntry(BACKUP_ENTRY));
            zip.write(objectMapper.writeValueAsBytes(payload));
            zip.closeArchiveEntry();
            zip.finish();
        }
        log.info("Exported {} work items of project {}", items.size(), projectId);
    }

    public BackupImportReport importProject(String projectId, MultipartFile file) {
        JsonNode payload;
        try (InputStream in = file.getInputStream()) {
            payload = readBackupEntry(in);
        } catch (IOException e) {
            throw new InvalidArgumentException("Could not read backup archive: " + e.getMessage());
        }
        if (payload == null) {
            throw new InvalidArgumentException("Archive does not contain " + BACKUP_ENTRY);
        }
        JsonNode rawItems = payload.path("items");
        if (!rawItems.isArray()) {
            throw new InvalidArgumentException(BACKUP_ENTRY + " has no items array");
        }
        if (rawItems.size() > properties.importMaxItems()) {
            throw new InvalidArgumentException("Backup holds " + rawItems.size() + " items; the limit is " + properties.importMaxItems());
        }

        List<ArchivedItem> archived = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (JsonNode raw : rawItems) {
            try {
                archived.add(ArchivedItem.from(raw));
            } catch (WorkPlanException e) {
                errors.add("Skipped malformed item " + raw.path("id").asText("?") + ": " + e.getMessage());
            }
        }
        // parents always have a shallower type than their children
        archived.sort(Comparator.comparing((ArchivedItem a) -> a.type().ordinal())
                .thenComparingDouble(ArchivedItem::orderIndex)
                .thenComparingLong(ArchivedItem::id));

        Map<Long, Long> newIds = new HashMap<>();
        int imported = 0;
        for (ArchivedItem item : archived) {
            Long parentId = null;
            if (item.parentId() != null) {
                parentId = newIds.get(item.parentId());
                if (parentId == null) {
                    errors.add("Item " + item.id() + " '" + item.title() + "': parent " + item.parentId() + " was not restored");
                    continue;
                }
            }
            try {
                WorkItemDtos.ItemResponse created = workItemService.create(projectId,
                        new WorkItemDtos.CreateItemRequest(item.type(), item.title(), item.description(), parentId, item.notes()));
                newIds.put(item.id(), created.id());
                imported++;
                restoreOrder(projectId, created, item.orderIndex());
                restoreStatus(projectId, created.id(), item.status());
            } catch (WorkPlanException e) {
                errors.add("Item " + item.id() + " '" + item.title() + "': " + e.getMessage());
            }
        }
        log.info("Imported {} of {} archived items into project {} ({} errors)", imported, rawItems.size(), projectId, errors.size());
        return new BackupImportReport(imported, errors);
    }

    private void restoreOrder(String projectId, WorkItemDtos.ItemResponse created, double orderIndex) {
        if (created.orderIndex() != orderIndex) {
            workItemService.update(created.id(), projectId, List.of(new FieldUpdate.OrderIndex(orderIndex)));
        }
    }

    private void restoreStatus(String projectId, long id, WorkStatus status) {
        switch (status) {
            case NOT_STARTED -> { }
            case IN_PROGRESS -> workItemService.update(id, projectId, List.of(new FieldUpdate.Status(WorkStatus.IN_PROGRESS)));
            case COMPLETED -> workItemService.complete(id, projectId);
        }
    }

    private JsonNode readBackupEntry(InputStream in) throws IOException {
        try (ZipArchiveInputStream zip = new ZipArchiveInputStream(in, StandardCharsets.UTF_8.name(), true, true, true)) {
            ZipArchiveEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (BACKUP_ENTRY.equals(entry.getName())) {
                    return objectMapper.readTree(zip.readAllBytes());
                }
            }
        }
        return null;
    }

    record ArchivedItem(long id, WorkItemType type, String title, String description, WorkStatus status,
                        Long parentId, String notes, double orderIndex) {
        static ArchivedItem from(JsonNode raw) {
            if (!raw.path("id").canConvertToLong()) throw new InvalidArgumentException("id is missing");
            String title = raw.path("title").asText("");
            if (title.isBlank()) throw new InvalidArgumentException("title is missing");
            JsonNode parent = raw.path("parentId");
            return new ArchivedItem(
                    raw.path("id").asLong(),
                    WorkItemType.fromWireName(raw.path("type").asText(null)),
                    title,
                    textOrNull(raw.path("description")),
                    raw.hasNonNull("status") ? WorkStatus.fromWireName(raw.path("status").asText()) : WorkStatus.NOT_STARTED,
                    parent.isNull() || parent.isMissingNode() ? null : parent.asLong(),
                    textOrNull(raw.path("notes")),
                    raw.path("orderIndex").asDouble(1.0));
        }

        private static String textOrNull(JsonNode node) {
            return node.isNull() || node.isMissingNode() ? null : node.asText();
        }
    }

    public record BackupImportReport(int importedItems, List<String> errors) {}
}
