package com.acme.workplan.plan;

import com.acme.workplan.workitem.WorkItemDtos;
import com.acme.workplan.workitem.WorkItemService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class PlanService {
    private static final Logger log = LoggerFactory.getLogger(PlanService.class);

    private final WorkItemService workItemService;
    private final RollingPlanBuilder builder;

    public PlanService(WorkItemService workItemService, RollingPlanBuilder builder) {
        this.workItemService = workItemService;
        this.builder = builder;
    }

    @Transactional(readOnly = true)
    public PlanDtos.RollingWorkPlan currentWorkPlan(String projectId) {
        List<WorkItemDtos.ItemResponse> items = workItemService.listByProject(projectId);
        PlanDtos.RollingWorkPlan plan = builder.build(projectId, items);
        log.debug("Built rolling plan for project {}: {} items, {} roots, {} unassigned",
                projectId, items.size(), plan.projects().size(), plan.unassigned().size());
        return plan;
    }
}
