package com.acme.workplan.plan;

import com.acme.workplan.domain.entity.WorkItemType;
import com.acme.workplan.domain.entity.WorkStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

public class PlanDtos {

    public record RollingWorkPlan(String projectId, List<PlanNode> projects, List<PlanNode> unassigned) {}

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = ExpandedNode.class, name = "item"),
            @JsonSubTypes.Type(value = CompletionSummary.class, name = "summary")
    })
    public sealed interface PlanNode permits ExpandedNode, CompletionSummary {
        Long id();
        WorkItemType type();
        String title();
        WorkStatus status();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ExpandedNode(
            Long id,
            WorkItemType type,
            String title,
            String description,
            WorkStatus status,
            String notes,
            Long parentId,
            double orderIndex,
            String progressText,
            List<PlanNode> children
    ) implements PlanNode {}

    public record CompletionSummary(Long id, WorkItemType type, String title, WorkStatus status, String summaryText) implements PlanNode {}
}
