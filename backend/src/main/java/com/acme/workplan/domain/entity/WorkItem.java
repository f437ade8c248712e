package com.acme.workplan.domain.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "work_items", indexes = {
        @Index(name = "idx_work_items_project", columnList = "projectId"),
        @Index(name = "idx_work_items_parent", columnList = "parentId"),
        @Index(name = "idx_work_items_status", columnList = "status")
})
public class WorkItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private String projectId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private WorkItemType type;

    @Column(nullable = false)
    private String title;

    @Column(length = 4000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private WorkStatus status;

    private Long parentId;

    @Column(length = 8000)
    private String notes;

    @Column(nullable = false)
    private double orderIndex;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    protected WorkItem() {
    }

    public WorkItem(String projectId, WorkItemType type) {
        this.projectId = projectId;
        this.type = type;
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        createdAt = now;
        updatedAt = now;
        if (status == null) status = WorkStatus.NOT_STARTED;
    }

    public void touch() {
        updatedAt = Instant.now();
    }

    public Long getId() { return id; }
    public String getProjectId() { return projectId; }
    public WorkItemType getType() { return type; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public WorkStatus getStatus() { return status; }
    public void setStatus(WorkStatus status) { this.status = status; }
    public Long getParentId() { return parentId; }
    public void setParentId(Long parentId) { this.parentId = parentId; }
    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
    public double getOrderIndex() { return orderIndex; }
    public void setOrderIndex(double orderIndex) { this.orderIndex = orderIndex; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
