package com.multila.backend.modules.export.domain;

/**
 * Progress of one file of an export job. Status changes and cancellation are guarded by the handle's
 * monitor, which the generating task also holds while publishing the final file.
 */
public class ExportFileHandle {

    private final String filename;
    private final ExportFileKind kind;
    private final String jobId;

    private ExportFileStatus status = ExportFileStatus.REQUESTED;
    private String failureMessage;
    private boolean cancelled;

    public ExportFileHandle(String filename, ExportFileKind kind, String jobId) {
        this.filename = filename;
        this.kind = kind;
        this.jobId = jobId;
    }

    public String getFilename() {
        return filename;
    }

    public ExportFileKind getKind() {
        return kind;
    }

    public String getJobId() {
        return jobId;
    }

    public synchronized ExportFileStatus getStatus() {
        return status;
    }

    public synchronized String getFailureMessage() {
        return failureMessage;
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    public synchronized boolean isReady() {
        return status == ExportFileStatus.READY;
    }

    public synchronized void markGenerating() {
        if (status == ExportFileStatus.REQUESTED) {
            status = ExportFileStatus.GENERATING;
        }
    }

    public synchronized void markReady() {
        status = ExportFileStatus.READY;
    }

    public synchronized void markFailed(String message) {
        status = ExportFileStatus.FAILED;
        failureMessage = message;
    }

    public synchronized void cancel() {
        cancelled = true;
    }
}
