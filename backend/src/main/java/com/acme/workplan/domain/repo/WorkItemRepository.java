package com.acme.workplan.domain.repo;

import com.acme.workplan.domain.entity.WorkItem;
import com.acme.workplan.domain.entity.WorkStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface WorkItemRepository extends JpaRepository<WorkItem, Long> {
    Optional<WorkItem> findByIdAndProjectId(Long id, String projectId);
    List<WorkItem> findByProjectId(String projectId);
    List<WorkItem> findByProjectIdAndStatusIn(String projectId, Collection<WorkStatus> statuses);
    List<WorkItem> findByProjectIdAndIdIn(String projectId, Collection<Long> ids);
    List<WorkItem> findByProjectIdAndTitleContainingIgnoreCase(String projectId, String keyword);
    List<WorkItem> findByProjectIdAndDescriptionContainingIgnoreCase(String projectId, String keyword);

    @Query("select max(w.orderIndex) from WorkItem w where w.projectId = :projectId and w.parentId = :parentId")
    Optional<Double> findMaxOrderIndexUnder(@Param("projectId") String projectId, @Param("parentId") Long parentId);

    @Query("select max(w.orderIndex) from WorkItem w where w.projectId = :projectId and w.parentId is null")
    Optional<Double> findMaxRootOrderIndex(@Param("projectId") String projectId);
}
