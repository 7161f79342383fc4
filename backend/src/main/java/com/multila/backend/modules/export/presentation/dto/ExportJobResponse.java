package com.multila.backend.modules.export.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

import com.multila.backend.modules.export.application.ExportFileView;
import com.multila.backend.modules.export.domain.ExportJob;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExportJobResponse(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        boolean ready,
        List<ExportFileResponse> files
) {

    public static ExportJobResponse from(ExportJob job) {
        List<ExportFileResponse> files = job.getFiles().stream()
                .map(ExportFileView::of)
                .map(ExportFileResponse::from)
                .toList();
        return new ExportJobResponse(job.getId(), job.getCreatedAt(), job.isReady(), files);
    }
}
