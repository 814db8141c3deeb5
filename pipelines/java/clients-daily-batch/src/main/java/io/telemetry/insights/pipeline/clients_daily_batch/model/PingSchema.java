package io.telemetry.insights.pipeline.clients_daily_batch.model;

import io.telemetry.insights.pipeline.clients_daily_batch.exception.SchemaViolationException;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record PingSchema(Map<String, ColumnType> columns) {

    public PingSchema {
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PingSchema mainSummary() {
        return builder()
                .column("normalized_channel", ColumnType.STRING)
                .column("app_version", ColumnType.STRING)
                .column("app_build_id", ColumnType.STRING)
                .column("os", ColumnType.STRING)
                .column("os_version", ColumnType.STRING)
                .column("locale", ColumnType.STRING)
                .column("country", ColumnType.STRING)
                .column("city", ColumnType.STRING)
                .column("geo_subdivision1", ColumnType.STRING)
                .column("default_search_engine", ColumnType.STRING)
                .column("distribution_id", ColumnType.STRING)
                .column("active_experiment_id", ColumnType.STRING)
                .column("active_experiment_branch", ColumnType.STRING)
                .column("sync_configured", ColumnType.BOOLEAN)
                .column("e10s_enabled", ColumnType.BOOLEAN)
                .column("is_default_browser", ColumnType.BOOLEAN)
                .column("cpu_count", ColumnType.LONG)
                .column("memory_mb", ColumnType.LONG)
                .column("subsession_length", ColumnType.LONG)
                .column("profile_subsession_counter", ColumnType.LONG)
                .column("aborts_content", ColumnType.LONG)
                .column("aborts_gmplugin", ColumnType.LONG)
                .column("aborts_plugin", ColumnType.LONG)
                .column("active_addons_count", ColumnType.LONG)
                .column("crashes_detected_content", ColumnType.LONG)
                .column("crashes_detected_gmplugin", ColumnType.LONG)
                .column("crashes_detected_plugin", ColumnType.LONG)
                .column("first_paint", ColumnType.LONG)
                .column("places_bookmarks_count", ColumnType.LONG)
                .column("places_pages_count", ColumnType.LONG)
                .column("push_api_notify", ColumnType.LONG)
                .column("sync_count_desktop", ColumnType.LONG)
                .column("sync_count_mobile", ColumnType.LONG)
                .column("scalar_parent_browser_engagement_max_concurrent_tab_count", ColumnType.LONG)
                .column("scalar_parent_browser_engagement_max_concurrent_window_count", ColumnType.LONG)
                .column("scalar_parent_browser_engagement_tab_open_event_count", ColumnType.LONG)
                .column("scalar_parent_browser_engagement_total_uri_count", ColumnType.LONG)
                .column("scalar_parent_browser_engagement_unique_domains_count", ColumnType.LONG)
                .column("scalar_parent_browser_engagement_window_open_event_count", ColumnType.LONG)
                .build();
    }

    public @Nullable ColumnType typeOf(String column) {
        return columns.get(column);
    }

    public ColumnType require(String column) {
        ColumnType type = columns.get(column);
        if (type == null) {
            throw new SchemaViolationException("Column '" + column + "' is not part of the ping schema");
        }
        return type;
    }

    public PingSchema withColumn(String column, ColumnType type) {
        Map<String, ColumnType> extended = new LinkedHashMap<>(columns);
        extended.put(column, type);
        return new PingSchema(extended);
    }

    public static final class Builder {

        private final Map<String, ColumnType> columns = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder column(String name, ColumnType type) {
            if (columns.putIfAbsent(name, type) != null) {
                throw new SchemaViolationException("Column '" + name + "' declared twice");
            }
            return this;
        }

        public PingSchema build() {
            return new PingSchema(columns);
        }
    }
}
