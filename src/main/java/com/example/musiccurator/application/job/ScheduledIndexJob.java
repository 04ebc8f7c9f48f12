package com.example.musiccurator.application.job;

import com.example.musiccurator.application.service.LibraryIndexService;
import com.example.musiccurator.common.config.AppLibraryProperties;
import com.example.musiccurator.common.exception.BusinessException;
import com.example.musiccurator.domain.model.IndexResult;
import com.example.musiccurator.domain.model.VerifyResult;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Keeps configured library roots current: incremental index, then verify.
 */
@Service
public class ScheduledIndexJob {

    private static final Logger log = LoggerFactory.getLogger(ScheduledIndexJob.class);

    private final AppLibraryProperties appLibraryProperties;
    private final LibraryIndexService libraryIndexService;

    public ScheduledIndexJob(AppLibraryProperties appLibraryProperties,
                             LibraryIndexService libraryIndexService) {
        this.appLibraryProperties = appLibraryProperties;
        this.libraryIndexService = libraryIndexService;
    }

    @Scheduled(cron = "${app.library.scheduled-index-cron:0 30 4 * * ?}")
    public void run() {
        List<String> roots = appLibraryProperties.getScheduledRoots();
        if (roots == null || roots.isEmpty()) {
            log.debug("Scheduled index skipped: no library roots configured");
            return;
        }
        log.info("Scheduled index triggered, rootCount={}, cron={}",
                roots.size(), appLibraryProperties.getScheduledIndexCron());
        for (String root : roots) {
            try {
                IndexResult indexed = libraryIndexService.index(root, false, true);
                VerifyResult verified = libraryIndexService.verify(root);
                log.info("Scheduled index finished, root={}, added={}, updated={}, unchanged={}, failed={}, missing={}",
                        root, indexed.getAdded(), indexed.getUpdated(), indexed.getUnchanged(),
                        indexed.getFailed(), verified.getMissingCount());
            } catch (BusinessException e) {
                log.warn("Scheduled index failed, root={}, code={}, msg={}", root, e.getCode(), e.getMessage());
            } catch (Exception e) {
                log.warn("Scheduled index failed unexpectedly, root={}", root, e);
            }
        }
    }
}
