package com.example.musiccurator.application.event;

import com.example.musiccurator.common.config.AppLibraryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingCurationEventSink implements CurationEventSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingCurationEventSink.class);

    private final int progressInterval;

    public LoggingCurationEventSink(AppLibraryProperties appLibraryProperties) {
        this.progressInterval = Math.max(1, appLibraryProperties.getProgressLogInterval());
    }

    @Override
    public void onFileProcessed(String operation, String path, String outcome, int processed, int total) {
        if (processed % progressInterval == 0 || processed == total) {
            log.info("PROGRESS op={} processed={}/{} last={} outcome={}", operation, processed, total, path, outcome);
        } else if (log.isDebugEnabled()) {
            log.debug("FILE_PROCESSED op={} path={} outcome={}", operation, path, outcome);
        }
    }

    @Override
    public void onGroupValidated(int groupId, boolean passed, String detail) {
        if (passed) {
            log.debug("GROUP_VALIDATED groupId={} detail={}", groupId, detail);
        } else {
            log.warn("GROUP_EXCLUDED groupId={} detail={}", groupId, detail);
        }
    }

    @Override
    public void onPhaseComplete(String operation, String phase) {
        log.info("PHASE_COMPLETE op={} phase={}", operation, phase);
    }
}
