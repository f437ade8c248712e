package com.acme.workplan.backup;

import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/api/projects/{projectId}/backup")
public class BackupController {
    private final BackupService backupService;

    public BackupController(BackupService backupService) {
        this.backupService = backupService;
    }

    @GetMapping(value = "/export", produces = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public void export(@PathVariable String projectId, HttpServletResponse response) throws IOException {
        response.setHeader("Content-Disposition", "attachment; filename=work-plan-backup.zip");
        backupService.exportProject(projectId, response.getOutputStream());
    }

    @PostMapping("/import")
    public BackupService.BackupImportReport importZip(@PathVariable String projectId, @RequestParam("file") MultipartFile file) {
        return backupService.importProject(projectId, file);
    }
}
