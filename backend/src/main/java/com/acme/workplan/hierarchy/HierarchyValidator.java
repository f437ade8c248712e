package com.acme.workplan.hierarchy;

import com.acme.workplan.domain.entity.WorkItem;
import com.acme.workplan.domain.entity.WorkItemType;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

// nesting, then project scope, then the bounded walk; first failure wins. A cycle never reaches a root.
@Component
public class HierarchyValidator {
    public static final int MAX_DEPTH = 4;

    public record Node(long id, String projectId, WorkItemType type, Long parentId) {
        public static Node of(WorkItem item) {
            return new Node(item.getId(), item.getProjectId(), item.getType(), item.getParentId());
        }
    }

    public record Candidate(Long id, String projectId, WorkItemType type, Long parentId) {}

    @FunctionalInterface
    public interface NodeLookup {
        Optional<Node> find(long id);
    }

    public void validate(Candidate candidate, NodeLookup lookup) {
        Objects.requireNonNull(candidate.type(), "type");
        if (candidate.parentId() == null) {
            if (candidate.type() != WorkItemType.PROJECT) {
                throw new InvalidHierarchyException(HierarchyViolation.BAD_NESTING,
                        candidate.type().wireName() + " items cannot be top-level; only projects have no parent");
            }
            return;
        }
        if (candidate.type() == WorkItemType.PROJECT) {
            throw new InvalidHierarchyException(HierarchyViolation.BAD_NESTING, "project items cannot have a parent");
        }

        Node parent = resolve(candidate, candidate.parentId(), lookup);
        if (!parent.type().canContain(candidate.type())) {
            throw new InvalidHierarchyException(HierarchyViolation.BAD_NESTING,
                    candidate.type().wireName() + " items cannot be children of " + parent.type().wireName());
        }
        if (!parent.projectId().equals(candidate.projectId())) {
            throw new InvalidHierarchyException(HierarchyViolation.CROSS_PROJECT,
                    "Parent item " + parent.id() + " belongs to a different project");
        }
        checkDepth(candidate, lookup);
    }

    private void checkDepth(Candidate candidate, NodeLookup lookup) {
        int depth = 1;
        WorkItemType type = candidate.type();
        Long parentId = candidate.parentId();
        while (parentId != null) {
            if (depth >= MAX_DEPTH) {
                throw new InvalidHierarchyException(HierarchyViolation.DEPTH_EXCEEDED,
                        "Maximum hierarchy depth (" + MAX_DEPTH + ") exceeded");
            }
            Node ancestor = resolve(candidate, parentId, lookup);
            if (!ancestor.projectId().equals(candidate.projectId())) {
                throw new InvalidHierarchyException(HierarchyViolation.CROSS_PROJECT,
                        "Ancestor item " + ancestor.id() + " belongs to a different project");
            }
            depth++;
            type = ancestor.type();
            parentId = ancestor.parentId();
        }
        if (type != WorkItemType.PROJECT) {
            throw new InvalidHierarchyException(HierarchyViolation.MISSING_PARENT,
                    "Ancestor chain ends at a " + type.wireName() + " instead of a project");
        }
    }

    private Node resolve(Candidate candidate, long id, NodeLookup lookup) {
        // the candidate's proposed parent link replaces its stored one
        if (candidate.id() != null && candidate.id() == id) {
            return new Node(id, candidate.projectId(), candidate.type(), candidate.parentId());
        }
        return lookup.find(id).orElseThrow(() -> new InvalidHierarchyException(HierarchyViolation.MISSING_PARENT,
                "Parent item " + id + " does not exist"));
    }
}
