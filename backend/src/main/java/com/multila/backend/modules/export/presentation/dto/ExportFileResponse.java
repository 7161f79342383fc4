package com.multila.backend.modules.export.presentation.dto;

import com.multila.backend.modules.export.application.ExportFileView;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExportFileResponse(String filename, String kind, String status, boolean ready, String error) {

    public static ExportFileResponse from(ExportFileView view) {
        return new ExportFileResponse(
                view.filename(),
                view.kind() != null ? view.kind().fileStem() : null,
                view.status().name(),
                view.ready(),
                view.error()
        );
    }
}
