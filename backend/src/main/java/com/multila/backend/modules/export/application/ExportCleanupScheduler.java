package com.multila.backend.modules.export.application;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ExportCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExportCleanupScheduler.class);

    private final ExportJobService exportJobService;
    private final Duration retention;

    public ExportCleanupScheduler(
            ExportJobService exportJobService,
            @Value("${multila.export.retention:P7D}") Duration retention
    ) {
        this.exportJobService = exportJobService;
        this.retention = retention;
    }

    @Scheduled(fixedDelayString = "${multila.export.cleanup-interval:PT1H}",
            initialDelayString = "${multila.export.cleanup-interval:PT1H}")
    public void sweepExpiredExports() {
        try {
            ExportJobService.SweepResult result = exportJobService.sweep(retention);
            if (result.removedAnything()) {
                log.info("Export cleanup dropped {} jobs, {} files and {} temporary files",
                        result.droppedJobs(), result.removedFiles(), result.removedPartFiles());
            }
        } catch (RuntimeException ex) {
            log.error("Export cleanup failed", ex);
        }
    }
}
