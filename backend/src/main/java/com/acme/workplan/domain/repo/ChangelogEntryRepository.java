package com.acme.workplan.domain.repo;

import com.acme.workplan.domain.entity.ChangelogEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ChangelogEntryRepository extends JpaRepository<ChangelogEntry, Long> {
    List<ChangelogEntry> findByWorkItemIdAndProjectIdOrderByCreatedAtAscIdAsc(Long workItemId, String projectId);
    List<ChangelogEntry> findByProjectIdOrderByCreatedAtAscIdAsc(String projectId);
    List<ChangelogEntry> findByProjectIdOrderByCreatedAtDescIdDesc(String projectId, Pageable pageable);
}
