package com.multila.backend.modules.export.application;

import com.multila.backend.modules.export.domain.ExportFileHandle;
import com.multila.backend.modules.export.domain.ExportFileKind;
import com.multila.backend.modules.export.domain.ExportFileStatus;

/**
 * Snapshot of one export file. {@code kind} is null for files published by an earlier run.
 */
public record ExportFileView(String filename, ExportFileKind kind, ExportFileStatus status, String error) {

    public static ExportFileView of(ExportFileHandle handle) {
        return new ExportFileView(handle.getFilename(), handle.getKind(), handle.getStatus(), handle.getFailureMessage());
    }

    public boolean ready() {
        return status == ExportFileStatus.READY;
    }
}
