package com.acme.workplan.search;

import com.acme.workplan.common.InvalidArgumentException;
import com.acme.workplan.hierarchy.HierarchyValidator;
import com.acme.workplan.workitem.WorkItemDtos.ItemResponse;
import com.acme.workplan.workitem.WorkItemService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class SearchService {
    private static final Logger log = LoggerFactory.getLogger(SearchService.class);

    private static final Comparator<ItemResponse> RESULT_ORDER = Comparator
            .comparing((ItemResponse item) -> item.type().ordinal())
            .thenComparingDouble(ItemResponse::orderIndex)
            .thenComparing(ItemResponse::id);

    private final WorkItemService workItemService;

    public SearchService(WorkItemService workItemService) {
        this.workItemService = workItemService;
    }

    @Transactional(readOnly = true)
    public List<SearchDtos.SearchHit> search(String projectId, String query) {
        if (query == null || query.isBlank()) {
            throw new InvalidArgumentException("Search query cannot be empty");
        }
        List<ItemResponse> matches = workItemService.findMatching(projectId, query.trim());
        Map<Long, ItemResponse> known = loadAncestors(projectId, matches);

        List<SearchDtos.SearchHit> hits = matches.stream()
                .sorted(RESULT_ORDER)
                .map(item -> new SearchDtos.SearchHit(item, breadcrumb(item, known)))
                .toList();
        log.debug("Search for '{}' in project {}: found {} items", query, projectId, hits.size());
        return hits;
    }

    // one query per ancestor level
    private Map<Long, ItemResponse> loadAncestors(String projectId, List<ItemResponse> matches) {
        Map<Long, ItemResponse> known = new HashMap<>();
        matches.forEach(item -> known.put(item.id(), item));
        Set<Long> pending = missingParents(matches, known);
        for (int level = 0; level < HierarchyValidator.MAX_DEPTH && !pending.isEmpty(); level++) {
            List<ItemResponse> loaded = workItemService.findByIds(projectId, pending);
            loaded.forEach(item -> known.put(item.id(), item));
            pending = missingParents(loaded, known);
        }
        return known;
    }

    private static Set<Long> missingParents(List<ItemResponse> items, Map<Long, ItemResponse> known) {
        return items.stream()
                .map(ItemResponse::parentId)
                .filter(Objects::nonNull)
                .filter(id -> !known.containsKey(id))
                .collect(Collectors.toSet());
    }

    /**
     * Walks parent links upward. Stops early, keeping what it has, when a link does not
     * resolve or loops back.
     */
    static List<String> breadcrumb(ItemResponse item, Map<Long, ItemResponse> byId) {
        List<String> titles = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        seen.add(item.id());
        Long parentId = item.parentId();
        while (parentId != null && titles.size() < HierarchyValidator.MAX_DEPTH) {
            ItemResponse parent = byId.get(parentId);
            if (parent == null || !seen.add(parent.id())) break;
            titles.add(parent.title());
            parentId = parent.parentId();
        }
        Collections.reverse(titles);
        return List.copyOf(titles);
    }
}
