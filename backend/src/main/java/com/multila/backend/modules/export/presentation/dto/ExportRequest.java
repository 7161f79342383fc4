package com.multila.backend.modules.export.presentation.dto;

import java.time.LocalDate;

import com.multila.backend.modules.export.domain.ExportFilter;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExportRequest(
        LocalDate from,
        LocalDate to,
        @JsonProperty("application_id") Long applicationId,
        @JsonProperty("config_id") Long configId,
        @JsonProperty("app_sess_code") String appSessCode
) {

    public ExportFilter toFilter() {
        String code = appSessCode == null || appSessCode.isBlank() ? null : appSessCode.trim();
        return new ExportFilter(from, to, applicationId, configId, code);
    }
}
