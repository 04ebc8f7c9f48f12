package com.example.musiccurator.api.controller;

import com.example.musiccurator.api.request.IndexLibraryRequest;
import com.example.musiccurator.api.request.VerifyLibraryRequest;
import com.example.musiccurator.api.response.ApiResponse;
import com.example.musiccurator.application.service.LibraryIndexService;
import com.example.musiccurator.application.service.VettingService;
import com.example.musiccurator.domain.model.IndexResult;
import com.example.musiccurator.domain.model.LibraryStatistics;
import com.example.musiccurator.domain.model.VerifyResult;
import com.example.musiccurator.infrastructure.catalog.LibraryCatalog;
import com.example.musiccurator.infrastructure.persistence.entity.VettingSessionEntity;
import java.util.List;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/library")
public class LibraryController {

    private final LibraryIndexService libraryIndexService;
    private final VettingService vettingService;
    private final LibraryCatalog libraryCatalog;

    public LibraryController(LibraryIndexService libraryIndexService,
                             VettingService vettingService,
                             LibraryCatalog libraryCatalog) {
        this.libraryIndexService = libraryIndexService;
        this.vettingService = vettingService;
        this.libraryCatalog = libraryCatalog;
    }

    @PostMapping("/index")
    public ApiResponse<IndexResult> index(@Valid @RequestBody IndexLibraryRequest request) {
        IndexResult result = libraryIndexService.index(request.getPath(), request.isRescan(), request.isIncremental());
        if (result.getFailed() > 0) {
            return ApiResponse.partial(result, result.getFailed() + " file(s) could not be indexed");
        }
        return ApiResponse.success(result);
    }

    @PostMapping("/verify")
    public ApiResponse<VerifyResult> verify(@RequestBody(required = false) VerifyLibraryRequest request) {
        return ApiResponse.success(libraryIndexService.verify(request == null ? null : request.getPath()));
    }

    @GetMapping("/stats")
    public ApiResponse<LibraryStatistics> statistics() {
        return ApiResponse.success(libraryCatalog.statistics());
    }

    @GetMapping("/history")
    public ApiResponse<List<VettingSessionEntity>> history(
            @RequestParam(value = "limit", required = false) Integer limit) {
        return ApiResponse.success(vettingService.history(limit));
    }
}
