package com.acme.workplan.identity;

import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/projects")
public class IdentityController {
    private final ProjectIdentity projectIdentity;

    public IdentityController(ProjectIdentity projectIdentity) {
        this.projectIdentity = projectIdentity;
    }

    @PostMapping("/identify")
    public IdentityDtos.ProjectIdResponse identify(@RequestBody @Valid IdentityDtos.IdentifyRequest request) {
        return projectIdentity.identify(request.descriptor());
    }

    @GetMapping("/{projectId}/identity")
    public IdentityDtos.ProjectIdResponse describe(@PathVariable String projectId) {
        return projectIdentity.decode(projectId);
    }
}
