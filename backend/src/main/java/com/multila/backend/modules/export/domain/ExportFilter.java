package com.multila.backend.modules.export.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Selection of the data to export. Every criterion is optional; dates are inclusive and apply to the
 * start of tracking sessions in the export time zone.
 */
public record ExportFilter(LocalDate from, LocalDate to, Long applicationId, Long configId, String appSessCode) {

    public static ExportFilter all() {
        return new ExportFilter(null, null, null, null, null);
    }

    /**
     * Short file-name-safe description of this filter.
     */
    public String scope() {
        List<String> parts = new ArrayList<>();
        if (applicationId != null) {
            parts.add("app" + applicationId);
        }
        if (configId != null) {
            parts.add("cfg" + configId);
        }
        if (appSessCode != null) {
            parts.add("sess-" + appSessCode.replaceAll("[^A-Za-z0-9]", ""));
        }
        if (from != null) {
            parts.add("from" + from.toString().replace("-", ""));
        }
        if (to != null) {
            parts.add("to" + to.toString().replace("-", ""));
        }
        return parts.isEmpty() ? "all" : String.join("-", parts);
    }
}
