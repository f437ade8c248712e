package com.acme.workplan.workitem;

import com.acme.workplan.domain.entity.WorkItemType;
import com.acme.workplan.domain.entity.WorkStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class WorkItemDtos {
    public record CreateItemRequest(@NotNull WorkItemType type, @NotBlank String title, String description, Long parentId, String notes) {}

    // null members are left unchanged
    public record UpdateItemRequest(String title, String description, WorkStatus status, String notes, Long parentId, Double orderIndex) {
        public List<FieldUpdate> toFieldUpdates() {
            List<FieldUpdate> updates = new ArrayList<>();
            if (title != null) updates.add(new FieldUpdate.Title(title));
            if (description != null) updates.add(new FieldUpdate.Description(description));
            if (status != null) updates.add(new FieldUpdate.Status(status));
            if (notes != null) updates.add(new FieldUpdate.Notes(notes));
            if (parentId != null) updates.add(new FieldUpdate.Parent(parentId));
            if (orderIndex != null) updates.add(new FieldUpdate.OrderIndex(orderIndex));
            return updates;
        }
    }

    public record ItemResponse(
            Long id,
            String projectId,
            WorkItemType type,
            String title,
            String description,
            WorkStatus status,
            Long parentId,
            String notes,
            double orderIndex,
            Instant createdAt,
            Instant updatedAt
    ) {}
}
