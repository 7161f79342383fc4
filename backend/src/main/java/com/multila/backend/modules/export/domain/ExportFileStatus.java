package com.multila.backend.modules.export.domain;

public enum ExportFileStatus {
    REQUESTED,
    GENERATING,
    READY,
    FAILED;

    public boolean terminal() {
        return this == READY || this == FAILED;
    }
}
