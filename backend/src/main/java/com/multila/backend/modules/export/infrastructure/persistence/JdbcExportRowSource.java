package com.multila.backend.modules.export.infrastructure.persistence;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.multila.backend.modules.export.application.ExportRowSource;
import com.multila.backend.modules.export.domain.ExportFileKind;
import com.multila.backend.modules.export.domain.ExportFilter;

import javax.sql.DataSource;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Export rows straight from the relational store. Each query joins down to the application so every
 * filter criterion applies uniformly; timestamps are rendered in the export time zone.
 */
@Component
public class JdbcExportRowSource implements ExportRowSource {

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSSxx");

    private static final int FETCH_SIZE = 500;

    private static final String APP_SESSIONS_SQL = """
            select a.id as app_id, a.name as app_name, a.url as app_url,
                   c.id as app_config_id, c.label as app_config_label,
                   s.code as app_sess_code, lower(s.auth_mode) as app_sess_auth_mode
            from application_session s
            join application_config c on c.id = s.config_id
            join application a on a.id = c.application_id
            where 1 = 1 %s
            order by a.id, c.id, s.code
            """;

    private static final String TRACKING_SESSIONS_SQL = """
            select s.code as app_sess_code, ua.code as user_app_sess_code, ua.user_id as user_app_sess_user_id,
                   t.id as track_sess_id, t.start_time as track_sess_start, t.end_time as track_sess_end,
                   t.device_info as track_sess_device_info
            from user_app_session ua
            join application_session s on s.code = ua.application_session_code
            join application_config c on c.id = s.config_id
            join application a on a.id = c.application_id
            left join tracking_session t on t.user_app_session_id = ua.id
            where 1 = 1 %s
            order by ua.id, t.start_time, t.id
            """;

    private static final String TRACKING_EVENTS_SQL = """
            select t.id as track_sess_id, e.event_time as event_time, e.event_type as event_type,
                   e.event_value as event_value
            from tracking_event e
            join tracking_session t on t.id = e.tracking_session_id
            join user_app_session ua on ua.id = t.user_app_session_id
            join application_session s on s.code = ua.application_session_code
            join application_config c on c.id = s.config_id
            join application a on a.id = c.application_id
            where 1 = 1 %s
            order by t.id, e.event_time, e.id
            """;

    private static final String USER_FEEDBACK_SQL = """
            select s.code as app_sess_code, ua.code as user_app_sess_code, ua.user_id as user_app_sess_user_id,
                   fb.tracking_session_id as track_sess_id, fb.created_at as feedback_created,
                   fb.content_section as feedback_content_section, fb.score as feedback_score,
                   fb.text as feedback_text
            from user_feedback fb
            join user_app_session ua on ua.id = fb.user_app_session_id
            join application_session s on s.code = ua.application_session_code
            join application_config c on c.id = s.config_id
            join application a on a.id = c.application_id
            where 1 = 1 %s
            order by ua.id, fb.created_at, fb.id
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ZoneId displayZone;

    public JdbcExportRowSource(DataSource dataSource, ZoneId displayZone) {
        JdbcTemplate streaming = new JdbcTemplate(dataSource);
        streaming.setFetchSize(FETCH_SIZE);
        this.jdbcTemplate = new NamedParameterJdbcTemplate(streaming);
        this.displayZone = displayZone;
    }

    @Override
    @Transactional(readOnly = true)
    public void stream(ExportFileKind kind, ExportFilter filter, RowHandler handler) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String sql = switch (kind) {
            case APP_SESSIONS -> APP_SESSIONS_SQL.formatted(appSessionConditions(filter, params));
            case TRACKING_SESSIONS -> TRACKING_SESSIONS_SQL.formatted(trackingConditions(filter, params));
            case TRACKING_EVENTS -> TRACKING_EVENTS_SQL.formatted(trackingConditions(filter, params));
            case USER_FEEDBACK -> USER_FEEDBACK_SQL.formatted(feedbackConditions(filter, params));
        };
        List<String> columns = kind.columns();

        jdbcTemplate.query(sql, params, (RowCallbackHandler) rs -> {
            Map<String, Object> row = new LinkedHashMap<>();
            for (String column : columns) {
                row.put(column, readColumn(rs, column));
            }
            try {
                handler.handle(row);
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
        });
    }

    private Object readColumn(ResultSet rs, String column) throws SQLException {
        Object value = rs.getObject(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Timestamp) {
            OffsetDateTime timestamp = rs.getObject(column, OffsetDateTime.class);
            return timestamp.atZoneSameInstant(displayZone).format(TIMESTAMP_FORMAT);
        }
        if (value instanceof Number || value instanceof String) {
            return value;
        }
        // uuid and jsonb
        return rs.getString(column);
    }

    private String appSessionConditions(ExportFilter filter, MapSqlParameterSource params) {
        List<String> conditions = commonConditions(filter, params);
        if (filter.from() != null || filter.to() != null) {
            List<String> timeConditions = timeConditions(filter, params);
            conditions.add("exists (select 1 from user_app_session ua join tracking_session t"
                    + " on t.user_app_session_id = ua.id where ua.application_session_code = s.code and "
                    + String.join(" and ", timeConditions) + ")");
        }
        return render(conditions);
    }

    private String trackingConditions(ExportFilter filter, MapSqlParameterSource params) {
        List<String> conditions = commonConditions(filter, params);
        conditions.addAll(timeConditions(filter, params));
        return render(conditions);
    }

    /**
     * Feedback may exist without a tracking session, so the date range applies to its creation time.
     */
    private String feedbackConditions(ExportFilter filter, MapSqlParameterSource params) {
        List<String> conditions = commonConditions(filter, params);
        conditions.addAll(timeConditions("fb.created_at", filter, params));
        return render(conditions);
    }

    private List<String> commonConditions(ExportFilter filter, MapSqlParameterSource params) {
        List<String> conditions = new ArrayList<>();
        if (filter.applicationId() != null) {
            conditions.add("a.id = :applicationId");
            params.addValue("applicationId", filter.applicationId());
        }
        if (filter.configId() != null) {
            conditions.add("c.id = :configId");
            params.addValue("configId", filter.configId());
        }
        if (filter.appSessCode() != null) {
            conditions.add("s.code = :appSessCode");
            params.addValue("appSessCode", filter.appSessCode());
        }
        return conditions;
    }

    private List<String> timeConditions(ExportFilter filter, MapSqlParameterSource params) {
        return timeConditions("t.start_time", filter, params);
    }

    private List<String> timeConditions(String column, ExportFilter filter, MapSqlParameterSource params) {
        List<String> conditions = new ArrayList<>();
        if (filter.from() != null) {
            conditions.add(column + " >= :fromTime");
            params.addValue("fromTime", filter.from().atStartOfDay(displayZone).toOffsetDateTime());
        }
        if (filter.to() != null) {
            conditions.add(column + " < :toTime");
            params.addValue("toTime", filter.to().plusDays(1).atStartOfDay(displayZone).toOffsetDateTime());
        }
        return conditions;
    }

    private static String render(List<String> conditions) {
        return conditions.isEmpty() ? "" : "and " + String.join(" and ", conditions);
    }
}
