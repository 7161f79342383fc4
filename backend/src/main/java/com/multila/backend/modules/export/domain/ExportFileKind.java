package com.multila.backend.modules.export.domain;

import java.util.List;

/**
 * The joined CSV artifacts of an export and their column order, linked through {@code app_sess_code}
 * and {@code track_sess_id}.
 */
public enum ExportFileKind {

    APP_SESSIONS("app_sessions", List.of(
            "app_id", "app_name", "app_url", "app_config_id", "app_config_label", "app_sess_code",
            "app_sess_auth_mode")),
    TRACKING_SESSIONS("tracking_sessions", List.of(
            "app_sess_code", "user_app_sess_code", "user_app_sess_user_id", "track_sess_id", "track_sess_start",
            "track_sess_end", "track_sess_device_info")),
    TRACKING_EVENTS("tracking_events", List.of(
            "track_sess_id", "event_time", "event_type", "event_value")),
    USER_FEEDBACK("user_feedback", List.of(
            "app_sess_code", "user_app_sess_code", "user_app_sess_user_id", "track_sess_id", "feedback_created",
            "feedback_content_section", "feedback_score", "feedback_text"));

    private final String fileStem;
    private final List<String> columns;

    ExportFileKind(String fileStem, List<String> columns) {
        this.fileStem = fileStem;
        this.columns = columns;
    }

    public String fileStem() {
        return fileStem;
    }

    public List<String> columns() {
        return columns;
    }
}
