package com.example.musiccurator.api.controller;

import com.example.musiccurator.api.request.VetFolderRequest;
import com.example.musiccurator.api.response.ApiResponse;
import com.example.musiccurator.application.service.VettingService;
import com.example.musiccurator.domain.model.ExportOptions;
import com.example.musiccurator.domain.model.VettingResult;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/vet")
public class VettingController {

    private final VettingService vettingService;

    public VettingController(VettingService vettingService) {
        this.vettingService = vettingService;
    }

    @PostMapping
    public ApiResponse<VettingResult> vet(@Valid @RequestBody VetFolderRequest request) {
        ExportOptions exports = vettingService.defaultExportOptions();
        if (request.getExportNew() != null) {
            exports.setExportNew(request.getExportNew());
        }
        if (request.getExportDuplicates() != null) {
            exports.setExportDuplicates(request.getExportDuplicates());
        }
        if (request.getExportUncertain() != null) {
            exports.setExportUncertain(request.getExportUncertain());
        }
        VettingResult result = vettingService.vet(request.getFolder(), request.getThreshold(), exports);
        if (result.getErrorCount() > 0 || !result.getExportFailures().isEmpty()) {
            return ApiResponse.partial(result, result.getErrorCount() + " file error(s), "
                    + result.getExportFailures().size() + " export failure(s)");
        }
        return ApiResponse.success(result);
    }
}
