package com.acme.workplan.search;

import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/projects/{projectId}/search")
public class SearchController {
    private final SearchService searchService;

    public SearchController(SearchService searchService) {
        this.searchService = searchService;
    }

    @GetMapping
    public List<SearchDtos.SearchHit> search(@PathVariable String projectId, @RequestParam("q") String q) {
        return searchService.search(projectId, q);
    }
}
