package com.acme.workplan.changelog;

import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/projects/{projectId}")
public class ChangelogController {
    private final ChangelogService changelogService;

    public ChangelogController(ChangelogService changelogService) {
        this.changelogService = changelogService;
    }

    @GetMapping("/changelog")
    public List<ChangelogDtos.EntryResponse> forProject(
            @PathVariable String projectId,
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        return changelogService.listForProject(projectId, limit);
    }

    @GetMapping("/items/{id}/changelog")
    public List<ChangelogDtos.EntryResponse> forItem(@PathVariable String projectId, @PathVariable long id) {
        return changelogService.listForItem(projectId, id);
    }
}
