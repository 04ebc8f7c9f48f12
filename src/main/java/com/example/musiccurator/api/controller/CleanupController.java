package com.example.musiccurator.api.controller;

import com.example.musiccurator.api.request.CreateCleanupPlanRequest;
import com.example.musiccurator.api.request.ExecuteCleanupRequest;
import com.example.musiccurator.api.response.ApiResponse;
import com.example.musiccurator.api.response.CleanupPlanResponse;
import com.example.musiccurator.application.service.SmartCleanupService;
import com.example.musiccurator.domain.enumtype.CleanupStatus;
import com.example.musiccurator.domain.model.CleanupReport;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/cleanup")
public class CleanupController {

    private final SmartCleanupService smartCleanupService;

    public CleanupController(SmartCleanupService smartCleanupService) {
        this.smartCleanupService = smartCleanupService;
    }

    @PostMapping("/plans")
    public ApiResponse<CleanupPlanResponse> createPlan(@RequestBody(required = false) CreateCleanupPlanRequest request) {
        return ApiResponse.success(CleanupPlanResponse.from(
                smartCleanupService.plan(request == null ? null : request.getMode())));
    }

    @GetMapping("/plans/{id}")
    public ApiResponse<CleanupPlanResponse> getPlan(@PathVariable("id") String id) {
        return ApiResponse.success(CleanupPlanResponse.from(smartCleanupService.getPlan(id)));
    }

    @PostMapping("/plans/{id}/export")
    public ApiResponse<String> exportPlan(@PathVariable("id") String id) {
        return ApiResponse.success(smartCleanupService.exportPlan(id).toString());
    }

    @PostMapping("/plans/{id}/execute")
    public ApiResponse<CleanupReport> execute(@PathVariable("id") String id,
                                              @Valid @RequestBody ExecuteCleanupRequest request) {
        CleanupReport report = smartCleanupService.execute(id, request.getConfirmation(), request.getDecisions(),
                request.getBackupDir(), request.isDryRun(), () -> false);
        if (report.getStatus() == CleanupStatus.BACKUP_FAILED) {
            return ApiResponse.fail("BACKUP_FAILED", report.getMessage(), "Check the backup directory and retry");
        }
        if (report.getStatus() == CleanupStatus.PARTIAL_SUCCESS) {
            return ApiResponse.partial(report, report.getFailedCount() + " file(s) could not be deleted");
        }
        return ApiResponse.success(report);
    }
}
