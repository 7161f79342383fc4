package com.multila.backend.modules.export.application;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import com.multila.backend.global.common.SecureCodeGenerator;
import com.multila.backend.global.config.TaskExecutionConfig;
import com.multila.backend.global.error.ProblemException;
import com.multila.backend.global.error.RetryableProblemException;
import com.multila.backend.modules.export.domain.ExportFileHandle;
import com.multila.backend.modules.export.domain.ExportFileKind;
import com.multila.backend.modules.export.domain.ExportFileStatus;
import com.multila.backend.modules.export.domain.ExportFilter;
import com.multila.backend.modules.export.domain.ExportJob;
import com.multila.backend.modules.export.infrastructure.ExportStorage;
import com.multila.backend.modules.export.infrastructure.csv.ExportCsvWriter;
import com.multila.backend.modules.export.infrastructure.csv.ExportCsvWriter.CsvRowWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Runs exports in the background, one task per file, and serves their progress and results.
 *
 * <p>Every request gets freshly named files, so two jobs never write the same file. A deleted file is
 * cancelled under the handle's monitor; a task that finishes afterwards discards its output instead of
 * publishing it.
 */
@Service
public class ExportJobService {

    private static final Logger log = LoggerFactory.getLogger(ExportJobService.class);

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    private final ExportFilterValidator filterValidator;
    private final ExportRowSource rowSource;
    private final ExportCsvWriter csvWriter;
    private final ExportStorage storage;
    private final TaskExecutor executor;
    private final SecureCodeGenerator codeGenerator;
    private final Clock clock;
    private final ZoneId displayZone;
    private final int retryAfterSeconds;

    private final Map<String, ExportJob> jobs = new ConcurrentHashMap<>();
    private final Map<String, ExportFileHandle> handlesByFilename = new ConcurrentHashMap<>();

    public ExportJobService(
            ExportFilterValidator filterValidator,
            ExportRowSource rowSource,
            ExportCsvWriter csvWriter,
            ExportStorage storage,
            @Qualifier(TaskExecutionConfig.EXPORT_TASK_EXECUTOR) TaskExecutor executor,
            SecureCodeGenerator codeGenerator,
            Clock clock,
            ZoneId displayZone,
            @Value("${multila.export.retry-after-seconds:2}") int retryAfterSeconds
    ) {
        this.filterValidator = filterValidator;
        this.rowSource = rowSource;
        this.csvWriter = csvWriter;
        this.storage = storage;
        this.executor = executor;
        this.codeGenerator = codeGenerator;
        this.clock = clock;
        this.displayZone = displayZone;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    /**
     * Validates the filter and schedules generation of one file per {@link ExportFileKind}. Returns without waiting.
     */
    public ExportJob start(ExportFilter filter) {
        filterValidator.validate(filter);
        try {
            storage.ensureDirectory();
        } catch (IOException ex) {
            throw new ProblemException(HttpStatus.INTERNAL_SERVER_ERROR, "EXPORT_DIRECTORY_UNAVAILABLE",
                    "export directory is not writable", ex);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        String jobId = codeGenerator.nextHex(6);
        String prefix = now.atZoneSameInstant(displayZone).format(FILE_TIMESTAMP) + "_" + filter.scope() + "_" + jobId;
        List<ExportFileHandle> handles = new ArrayList<>();
        for (ExportFileKind kind : ExportFileKind.values()) {
            handles.add(new ExportFileHandle(prefix + "_" + kind.fileStem() + ".csv", kind, jobId));
        }

        ExportJob job = new ExportJob(jobId, now, handles);
        jobs.put(jobId, job);
        handles.forEach(handle -> handlesByFilename.put(handle.getFilename(), handle));
        log.info("Started export job {} with scope {}", jobId, filter.scope());

        for (ExportFileHandle handle : handles) {
            try {
                executor.execute(() -> generate(handle, filter));
            } catch (TaskRejectedException ex) {
                log.error("Export queue rejected file {}", handle.getFilename(), ex);
                handle.markFailed("export queue is full");
            }
        }
        return job;
    }

    public ExportJob poll(String jobId) {
        ExportJob job = jobs.get(jobId);
        if (job == null) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "EXPORT_JOB_NOT_FOUND", "unknown export job " + jobId);
        }
        return job;
    }

    /**
     * Tracked files plus published files from earlier runs, newest name first.
     */
    public List<ExportFileView> listFiles() {
        Map<String, ExportFileView> views = new LinkedHashMap<>();
        for (String filename : storage.listFilenames()) {
            views.put(filename, new ExportFileView(filename, null, ExportFileStatus.READY, null));
        }
        for (ExportFileHandle handle : handlesByFilename.values()) {
            views.put(handle.getFilename(), ExportFileView.of(handle));
        }
        return views.values().stream()
                .sorted((a, b) -> b.filename().compareTo(a.filename()))
                .toList();
    }

    /**
     * @return path of a fully written file
     */
    public Path download(String filename) {
        Path path = storage.resolve(filename);
        ExportFileHandle handle = handlesByFilename.get(filename);
        if (handle != null) {
            ExportFileStatus status = handle.getStatus();
            if (status == ExportFileStatus.FAILED) {
                throw new ProblemException(HttpStatus.CONFLICT, "EXPORT_GENERATION_FAILED",
                        "generation of " + filename + " failed: " + handle.getFailureMessage());
            }
            if (status != ExportFileStatus.READY) {
                throw new RetryableProblemException(HttpStatus.CONFLICT, "EXPORT_FILE_NOT_READY",
                        filename + " is still being generated", retryAfterSeconds);
            }
        }
        if (!Files.isRegularFile(path)) {
            throw notFound(filename);
        }
        return path;
    }

    /**
     * Removes a file, cancelling its generation if it is still running.
     */
    public void delete(String filename) {
        storage.resolve(filename);
        ExportFileHandle handle = handlesByFilename.remove(filename);
        if (handle != null) {
            synchronized (handle) {
                handle.cancel();
            }
            ExportJob job = jobs.get(handle.getJobId());
            if (job != null) {
                job.removeFile(filename);
            }
        }
        boolean removed = storage.delete(filename);
        if (handle == null && !removed) {
            throw notFound(filename);
        }
        log.info("Deleted export file {}", filename);
    }

    /**
     * Drops finished jobs and published files older than {@code retention} and orphaned temporary files.
     */
    public SweepResult sweep(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        int droppedJobs = 0;
        for (ExportJob job : List.copyOf(jobs.values())) {
            if (job.isFinished() && job.getCreatedAt().toInstant().isBefore(cutoff)) {
                jobs.remove(job.getId());
                job.getFilenames().forEach(handlesByFilename::remove);
                droppedJobs++;
            }
        }
        int removedFiles = storage.deleteOlderThan(cutoff);
        int removedParts = storage.deleteOrphanedPartFiles(inFlightFilenames());
        return new SweepResult(droppedJobs, removedFiles, removedParts);
    }

    private Set<String> inFlightFilenames() {
        Collection<ExportFileHandle> handles = handlesByFilename.values();
        return handles.stream()
                .filter(handle -> !handle.getStatus().terminal())
                .map(ExportFileHandle::getFilename)
                .collect(Collectors.toSet());
    }

    void generate(ExportFileHandle handle, ExportFilter filter) {
        if (handle.isCancelled()) {
            return;
        }
        handle.markGenerating();
        Path partFile = storage.partFileFor(handle.getFilename());
        Path target = storage.resolve(handle.getFilename());
        long rows;
        try {
            try (BufferedWriter out = Files.newBufferedWriter(partFile, StandardCharsets.UTF_8);
                 CsvRowWriter rowWriter = csvWriter.open(handle.getKind(), out)) {
                rowSource.stream(handle.getKind(), filter, row -> {
                    if (handle.isCancelled()) {
                        throw new CancellationException(handle.getFilename() + " was deleted");
                    }
                    rowWriter.handle(row);
                });
                rows = rowWriter.rowCount();
            }
            synchronized (handle) {
                if (handle.isCancelled()) {
                    storage.deletePartFile(partFile);
                    log.info("Discarded export file {} deleted during generation", handle.getFilename());
                    return;
                }
                storage.publish(partFile, target);
                handle.markReady();
            }
            log.info("Export file {} ready with {} rows", handle.getFilename(), rows);
        } catch (CancellationException ex) {
            storage.deletePartFile(partFile);
            log.info("Stopped generating export file {}: {}", handle.getFilename(), ex.getMessage());
        } catch (Exception ex) {
            storage.deletePartFile(partFile);
            handle.markFailed(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
            log.error("Export file {} failed", handle.getFilename(), ex);
        }
    }

    private static ProblemException notFound(String filename) {
        return new ProblemException(HttpStatus.NOT_FOUND, "EXPORT_FILE_NOT_FOUND", "unknown export file " + filename);
    }

    public record SweepResult(int droppedJobs, int removedFiles, int removedPartFiles) {

        public boolean removedAnything() {
            return droppedJobs > 0 || removedFiles > 0 || removedPartFiles > 0;
        }
    }
}
