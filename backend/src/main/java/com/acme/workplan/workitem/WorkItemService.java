package com.acme.workplan.workitem;

import com.acme.workplan.changelog.ChangelogService;
import com.acme.workplan.common.InvalidArgumentException;
import com.acme.workplan.common.NotFoundException;
import com.acme.workplan.domain.entity.ChangeAction;
import com.acme.workplan.domain.entity.WorkItem;
import com.acme.workplan.domain.entity.WorkStatus;
import com.acme.workplan.domain.repo.WorkItemRepository;
import com.acme.workplan.hierarchy.HierarchyValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

@Service
public class WorkItemService {
    private static final Logger log = LoggerFactory.getLogger(WorkItemService.class);

    static final double FIRST_ORDER_INDEX = 1.0;
    static final double ORDER_GAP = 10.0;

    private final WorkItemRepository itemRepo;
    private final HierarchyValidator validator;
    private final ChangelogService changelog;

    public WorkItemService(WorkItemRepository itemRepo, HierarchyValidator validator, ChangelogService changelog) {
        this.itemRepo = itemRepo;
        this.validator = validator;
        this.changelog = changelog;
    }

    @Transactional
    public WorkItemDtos.ItemResponse create(String projectId, WorkItemDtos.CreateItemRequest request) {
        requireProjectId(projectId);
        if (request.type() == null) throw new InvalidArgumentException("type is required");
        String title = requireTitle(request.title());
        if (request.parentId() != null) resolveParent(request.parentId());
        validator.validate(new HierarchyValidator.Candidate(null, projectId, request.type(), request.parentId()), this::lookup);

        WorkItem item = new WorkItem(projectId, request.type());
        item.setTitle(title);
        item.setDescription(request.description());
        item.setNotes(request.notes());
        item.setParentId(request.parentId());
        item.setStatus(WorkStatus.NOT_STARTED);
        item.setOrderIndex(nextOrderIndex(projectId, request.parentId()));
        itemRepo.save(item);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", item.getType().wireName());
        details.put("title", item.getTitle());
        if (item.getDescription() != null) details.put("description", item.getDescription());
        if (item.getParentId() != null) details.put("parentId", item.getParentId());
        details.put("orderIndex", item.getOrderIndex());
        changelog.append(item.getId(), projectId, ChangeAction.CREATE, details);

        log.info("Created work item {}: {} '{}' in project {}", item.getId(), item.getType().wireName(), item.getTitle(), projectId);
        return toResponse(item);
    }

    @Transactional
    public WorkItemDtos.ItemResponse update(long id, String projectId, List<FieldUpdate> updates) {
        if (updates == null || updates.isEmpty()) throw new InvalidArgumentException("No updates provided");
        Set<UpdatableField> seen = EnumSet.noneOf(UpdatableField.class);
        for (FieldUpdate update : updates) {
            if (!seen.add(update.field())) {
                throw new InvalidArgumentException("Field '" + update.field().key() + "' supplied more than once");
            }
        }
        WorkItem item = find(id, projectId);

        List<FieldChange> changes = new ArrayList<>();
        for (FieldUpdate update : updates) {
            Object oldValue = currentValue(item, update.field());
            Object newValue = checkedValue(item, update);
            if (!Objects.equals(oldValue, newValue)) {
                changes.add(new FieldChange(update, oldValue, newValue));
            }
        }
        if (changes.isEmpty()) {
            log.debug("Update of work item {} in project {} changed nothing", id, projectId);
            return toResponse(item);
        }

        for (FieldChange change : changes) {
            apply(item, change.update());
        }
        item.touch();
        itemRepo.save(item);

        for (FieldChange change : changes) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("field", change.update().field().key());
            details.put("old", change.oldValue());
            details.put("new", change.newValue());
            ChangeAction action = change.update() instanceof FieldUpdate.Parent ? ChangeAction.UPDATE : ChangeAction.FIELD_CHANGE;
            changelog.append(item.getId(), projectId, action, details);
        }
        log.info("Updated work item {} in project {}: {}", id, projectId,
                changes.stream().map(c -> c.update().field().key()).toList());
        return toResponse(item);
    }

    @Transactional
    public WorkItemDtos.ItemResponse complete(long id, String projectId) {
        WorkItem item = find(id, projectId);
        WorkStatus previous = item.getStatus();
        if (previous.isCompleted()) {
            log.info("Work item {} is already completed", id);
            return toResponse(item);
        }
        previous.checkTransitionTo(WorkStatus.COMPLETED);
        item.setStatus(WorkStatus.COMPLETED);
        item.touch();
        itemRepo.save(item);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("title", item.getTitle());
        details.put("from", previous.wireName());
        details.put("to", WorkStatus.COMPLETED.wireName());
        changelog.append(item.getId(), projectId, ChangeAction.COMPLETE, details);

        log.info("Completed work item {} in project {}: {}", id, projectId, item.getTitle());
        return toResponse(item);
    }

    @Transactional(readOnly = true)
    public WorkItemDtos.ItemResponse get(long id, String projectId) {
        return toResponse(find(id, projectId));
    }

    @Transactional(readOnly = true)
    public List<WorkItemDtos.ItemResponse> listByProject(String projectId) {
        requireProjectId(projectId);
        return itemRepo.findByProjectId(projectId).stream().map(this::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public List<WorkItemDtos.ItemResponse> listByProject(String projectId, Set<WorkStatus> statuses) {
        if (statuses == null || statuses.isEmpty()) return listByProject(projectId);
        requireProjectId(projectId);
        return itemRepo.findByProjectIdAndStatusIn(projectId, statuses).stream().map(this::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public List<WorkItemDtos.ItemResponse> findMatching(String projectId, String keyword) {
        requireProjectId(projectId);
        Map<Long, WorkItem> matches = new LinkedHashMap<>();
        itemRepo.findByProjectIdAndTitleContainingIgnoreCase(projectId, keyword).forEach(i -> matches.put(i.getId(), i));
        itemRepo.findByProjectIdAndDescriptionContainingIgnoreCase(projectId, keyword).forEach(i -> matches.putIfAbsent(i.getId(), i));
        return matches.values().stream().map(this::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public List<WorkItemDtos.ItemResponse> findByIds(String projectId, Collection<Long> ids) {
        requireProjectId(projectId);
        if (ids.isEmpty()) return List.of();
        return itemRepo.findByProjectIdAndIdIn(projectId, ids).stream().map(this::toResponse).toList();
    }

    private WorkItem find(long id, String projectId) {
        requireProjectId(projectId);
        return itemRepo.findByIdAndProjectId(id, projectId).orElseThrow(() -> NotFoundException.workItem(id, projectId));
    }

    private Optional<HierarchyValidator.Node> lookup(long id) {
        return itemRepo.findById(id).map(HierarchyValidator.Node::of);
    }

    private void resolveParent(long parentId) {
        if (!itemRepo.existsById(parentId)) {
            throw new NotFoundException("Parent item " + parentId + " does not exist");
        }
    }

    private double nextOrderIndex(String projectId, Long parentId) {
        var max = parentId == null
                ? itemRepo.findMaxRootOrderIndex(projectId)
                : itemRepo.findMaxOrderIndexUnder(projectId, parentId);
        return max.map(m -> m + ORDER_GAP).orElse(FIRST_ORDER_INDEX);
    }

    private Object currentValue(WorkItem item, UpdatableField field) {
        return switch (field) {
            case TITLE -> item.getTitle();
            case DESCRIPTION -> item.getDescription();
            case STATUS -> item.getStatus().wireName();
            case NOTES -> item.getNotes();
            case PARENT_ID -> item.getParentId();
            case ORDER_INDEX -> item.getOrderIndex();
        };
    }

    private Object checkedValue(WorkItem item, FieldUpdate update) {
        if (update instanceof FieldUpdate.Title t) {
            return requireTitle(t.value());
        }
        if (update instanceof FieldUpdate.Description d) {
            return d.value();
        }
        if (update instanceof FieldUpdate.Status s) {
            if (s.value() == null) throw new InvalidArgumentException("status must not be null");
            item.getStatus().checkTransitionTo(s.value());
            return s.value().wireName();
        }
        if (update instanceof FieldUpdate.Notes n) {
            return n.value();
        }
        if (update instanceof FieldUpdate.Parent p) {
            if (!Objects.equals(item.getParentId(), p.value())) {
                resolveParent(p.value());
                validator.validate(new HierarchyValidator.Candidate(item.getId(), item.getProjectId(), item.getType(), p.value()), this::lookup);
            }
            return p.value();
        }
        if (update instanceof FieldUpdate.OrderIndex o) {
            if (Double.isNaN(o.value()) || Double.isInfinite(o.value())) {
                throw new InvalidArgumentException("orderIndex must be a finite number");
            }
            return o.value();
        }
        throw new IllegalStateException("Unhandled field update " + update);
    }

    private void apply(WorkItem item, FieldUpdate update) {
        if (update instanceof FieldUpdate.Title t) item.setTitle(t.value().trim());
        else if (update instanceof FieldUpdate.Description d) item.setDescription(d.value());
        else if (update instanceof FieldUpdate.Status s) item.setStatus(s.value());
        else if (update instanceof FieldUpdate.Notes n) item.setNotes(n.value());
        else if (update instanceof FieldUpdate.Parent p) item.setParentId(p.value());
        else if (update instanceof FieldUpdate.OrderIndex o) item.setOrderIndex(o.value());
    }

    private static String requireTitle(String title) {
        if (title == null || title.isBlank()) throw new InvalidArgumentException("title must not be empty");
        return title.trim();
    }

    private static void requireProjectId(String projectId) {
        if (projectId == null || projectId.isBlank()) throw new InvalidArgumentException("projectId must not be empty");
    }

    WorkItemDtos.ItemResponse toResponse(WorkItem item) {
        return new WorkItemDtos.ItemResponse(item.getId(), item.getProjectId(), item.getType(), item.getTitle(),
                item.getDescription(), item.getStatus(), item.getParentId(), item.getNotes(), item.getOrderIndex(),
                item.getCreatedAt(), item.getUpdatedAt());
    }

    private record FieldChange(FieldUpdate update, Object oldValue, Object newValue) {}
}
