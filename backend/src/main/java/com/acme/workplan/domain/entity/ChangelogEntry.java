package com.acme.workplan.domain.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "changelog", indexes = {
        @Index(name = "idx_changelog_project", columnList = "projectId"),
        @Index(name = "idx_changelog_item", columnList = "workItemId")
})
public class ChangelogEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long workItemId;

    @Column(nullable = false, updatable = false)
    private String projectId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private ChangeAction action;

    @Column(nullable = false, updatable = false, length = 16000)
    private String details;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    protected ChangelogEntry() {
    }

    public ChangelogEntry(Long workItemId, String projectId, ChangeAction action, String details) {
        this.workItemId = workItemId;
        this.projectId = projectId;
        this.action = action;
        this.details = details;
    }

    @PrePersist
    void onCreate() {
        createdAt = Instant.now();
    }

    public Long getId() { return id; }
    public Long getWorkItemId() { return workItemId; }
    public String getProjectId() { return projectId; }
    public ChangeAction getAction() { return action; }
    public String getDetails() { return details; }
    public Instant getCreatedAt() { return createdAt; }
}
