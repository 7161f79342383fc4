package com.multila.backend.modules.export.domain;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One export request and the files it generates. Files are removed from the job when deleted.
 */
public class ExportJob {

    private final String id;
    private final OffsetDateTime createdAt;
    private final List<String> filenames;
    private final Map<String, ExportFileHandle> files = new ConcurrentHashMap<>();

    public ExportJob(String id, OffsetDateTime createdAt, List<ExportFileHandle> handles) {
        this.id = id;
        this.createdAt = createdAt;
        this.filenames = handles.stream().map(ExportFileHandle::getFilename).toList();
        handles.forEach(handle -> files.put(handle.getFilename(), handle));
    }

    public String getId() {
        return id;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    /**
     * Remaining files in generation order.
     */
    public List<ExportFileHandle> getFiles() {
        return filenames.stream()
                .map(files::get)
                .filter(handle -> handle != null)
                .toList();
    }

    public Collection<String> getFilenames() {
        return filenames;
    }

    public void removeFile(String filename) {
        files.remove(filename);
    }

    public boolean isFinished() {
        return files.values().stream().allMatch(handle -> handle.getStatus().terminal());
    }

    /**
     * True only while every file the job was started with is still tracked and ready. A job that lost a
     * file to deletion never becomes ready again.
     */
    public boolean isReady() {
        return !filenames.isEmpty()
                && files.size() == filenames.size()
                && files.values().stream().allMatch(ExportFileHandle::isReady);
    }
}
