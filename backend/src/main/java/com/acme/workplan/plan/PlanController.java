package com.acme.workplan.plan;

import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/projects/{projectId}/plan")
public class PlanController {
    private final PlanService planService;

    public PlanController(PlanService planService) {
        this.planService = planService;
    }

    @GetMapping
    public PlanDtos.RollingWorkPlan current(@PathVariable String projectId) {
        return planService.currentWorkPlan(projectId);
    }
}
