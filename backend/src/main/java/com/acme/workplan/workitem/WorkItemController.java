package com.acme.workplan.workitem;

import com.acme.workplan.domain.entity.WorkStatus;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/projects/{projectId}/items")
public class WorkItemController {
    private final WorkItemService workItemService;

    public WorkItemController(WorkItemService workItemService) {
        this.workItemService = workItemService;
    }

    @PostMapping
    public WorkItemDtos.ItemResponse create(@PathVariable String projectId, @RequestBody @Valid WorkItemDtos.CreateItemRequest request) {
        return workItemService.create(projectId, request);
    }

    @GetMapping
    public List<WorkItemDtos.ItemResponse> list(
            @PathVariable String projectId,
            @RequestParam(value = "status", required = false) String status
    ) {
        if (status == null || status.isBlank()) {
            return workItemService.listByProject(projectId);
        }
        Set<WorkStatus> statuses = Arrays.stream(status.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(WorkStatus::fromWireName)
                .collect(Collectors.toSet());
        return workItemService.listByProject(projectId, statuses);
    }

    @GetMapping("/{id}")
    public WorkItemDtos.ItemResponse get(@PathVariable String projectId, @PathVariable long id) {
        return workItemService.get(id, projectId);
    }

    @PatchMapping("/{id}")
    public WorkItemDtos.ItemResponse update(
            @PathVariable String projectId,
            @PathVariable long id,
            @RequestBody WorkItemDtos.UpdateItemRequest request
    ) {
        return workItemService.update(id, projectId, request.toFieldUpdates());
    }

    @PostMapping("/{id}/complete")
    public WorkItemDtos.ItemResponse complete(@PathVariable String projectId, @PathVariable long id) {
        return workItemService.complete(id, projectId);
    }
}
