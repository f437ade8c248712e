package com.acme.workplan.plan;

import com.acme.workplan.domain.entity.WorkItemType;
import com.acme.workplan.workitem.WorkItemDtos.ItemResponse;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

// completed items collapse into summaries unless something below them is still open
@Component
public class RollingPlanBuilder {
    static final String COMPLETED_MARKER = "✓ completed";

    static final Comparator<ItemResponse> SIBLING_ORDER =
            Comparator.comparingDouble(ItemResponse::orderIndex).thenComparing(ItemResponse::id);

    public PlanDtos.RollingWorkPlan build(String projectId, List<ItemResponse> items) {
        return new Pass(items).run(projectId);
    }

    private static final class Pass {
        private final Map<Long, ItemResponse> byId = new HashMap<>();
        private final Map<Long, List<ItemResponse>> childrenByParent = new HashMap<>();
        private final Map<Long, Boolean> activeMemo = new HashMap<>();
        private final Set<Long> placed = new HashSet<>();
        private final List<ItemResponse> sorted;

        Pass(List<ItemResponse> items) {
            sorted = items.stream().sorted(SIBLING_ORDER).toList();
            for (ItemResponse item : sorted) {
                byId.put(item.id(), item);
            }
            for (ItemResponse item : sorted) {
                if (isAttached(item)) {
                    childrenByParent.computeIfAbsent(item.parentId(), k -> new ArrayList<>()).add(item);
                }
            }
        }

        PlanDtos.RollingWorkPlan run(String projectId) {
            List<PlanDtos.PlanNode> projects = new ArrayList<>();
            for (ItemResponse item : sorted) {
                if (item.parentId() == null && item.type() == WorkItemType.PROJECT) {
                    projects.add(render(item));
                }
            }

            List<PlanDtos.PlanNode> unassigned = new ArrayList<>();
            for (ItemResponse item : sorted) {
                if (!placed.contains(item.id()) && !isAttached(item) && !isRoot(item)) {
                    unassigned.add(render(item));
                }
            }
            // whatever is still unplaced sits on a parent cycle
            for (ItemResponse item : sorted) {
                if (!placed.contains(item.id())) {
                    unassigned.add(render(item));
                }
            }
            return new PlanDtos.RollingWorkPlan(projectId, List.copyOf(projects), List.copyOf(unassigned));
        }

        private boolean isRoot(ItemResponse item) {
            return item.parentId() == null && item.type() == WorkItemType.PROJECT;
        }

        private boolean isAttached(ItemResponse item) {
            return item.parentId() != null && !item.parentId().equals(item.id()) && byId.containsKey(item.parentId());
        }

        private List<ItemResponse> children(ItemResponse item) {
            return childrenByParent.getOrDefault(item.id(), List.of());
        }

        private PlanDtos.PlanNode render(ItemResponse item) {
            placed.add(item.id());
            List<ItemResponse> children = children(item).stream().filter(c -> !placed.contains(c.id())).toList();
            if (item.status().isCompleted() && !hasActiveDescendant(item)) {
                markSubtreePlaced(item);
                return new PlanDtos.CompletionSummary(item.id(), item.type(), item.title(), item.status(), summaryText(children(item)));
            }
            List<PlanDtos.PlanNode> rendered = new ArrayList<>();
            for (ItemResponse child : children) {
                if (!placed.contains(child.id())) {
                    rendered.add(render(child));
                }
            }
            return new PlanDtos.ExpandedNode(item.id(), item.type(), item.title(), item.description(), item.status(),
                    item.notes(), item.parentId(), item.orderIndex(), progressText(children(item)), List.copyOf(rendered));
        }

        private boolean hasActiveDescendant(ItemResponse item) {
            return hasActiveDescendant(item, new HashSet<>());
        }

        private boolean hasActiveDescendant(ItemResponse item, Set<Long> visiting) {
            Boolean memo = activeMemo.get(item.id());
            if (memo != null) return memo;
            if (!visiting.add(item.id())) return false;
            boolean active = false;
            for (ItemResponse child : children(item)) {
                if (!child.status().isCompleted() || hasActiveDescendant(child, visiting)) {
                    active = true;
                    break;
                }
            }
            activeMemo.put(item.id(), active);
            return active;
        }

        private void markSubtreePlaced(ItemResponse item) {
            for (ItemResponse child : children(item)) {
                if (placed.add(child.id())) {
                    markSubtreePlaced(child);
                }
            }
        }
    }

    static String summaryText(List<ItemResponse> children) {
        if (children.isEmpty()) return COMPLETED_MARKER;
        long completed = children.stream().filter(c -> c.status().isCompleted()).count();
        return completed + " of " + children.size() + " " + noun(children) + " completed";
    }

    static String progressText(List<ItemResponse> children) {
        long completed = children.stream().filter(c -> c.status().isCompleted()).count();
        if (completed == 0) return null;
        return completed + " of " + children.size() + " " + noun(children) + " completed";
    }

    private static String noun(List<ItemResponse> children) {
        WorkItemType first = children.get(0).type();
        boolean uniform = children.stream().allMatch(c -> c.type() == first);
        return uniform ? first.plural() : "items";
    }
}
