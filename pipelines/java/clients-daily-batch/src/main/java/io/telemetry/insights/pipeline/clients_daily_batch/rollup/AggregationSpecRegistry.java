package io.telemetry.insights.pipeline.clients_daily_batch.rollup;

import io.telemetry.insights.pipeline.clients_daily_batch.exception.SchemaViolationException;
import io.telemetry.insights.pipeline.clients_daily_batch.model.ClientDayAggregate;
import io.telemetry.insights.pipeline.clients_daily_batch.model.ColumnType;
import io.telemetry.insights.pipeline.clients_daily_batch.model.PingSchema;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class AggregationSpecRegistry {

    private final List<AggregationSpec> specs;

    private AggregationSpecRegistry(List<AggregationSpec> specs) {
        this.specs = List.copyOf(specs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AggregationSpecRegistry mainSummaryDefaults() {
        Builder builder = builder()
                .sum("aborts_content_sum", "aborts_content")
                .sum("aborts_gmplugin_sum", "aborts_gmplugin")
                .sum("aborts_plugin_sum", "aborts_plugin")
                .mean("active_addons_count_mean", "active_addons_count")
                .first("active_experiment_branch", "active_experiment_branch")
                .first("active_experiment_id", "active_experiment_id")
                .first("app_build_id", "app_build_id")
                .first("app_version", "app_version")
                .first("channel", "normalized_channel")
                .first("city", "city")
                .first("country", "country")
                .first("cpu_count", "cpu_count")
                .sum("crashes_detected_content_sum", "crashes_detected_content")
                .sum("crashes_detected_gmplugin_sum", "crashes_detected_gmplugin")
                .sum("crashes_detected_plugin_sum", "crashes_detected_plugin")
                .first("default_search_engine", "default_search_engine")
                .first("distribution_id", "distribution_id")
                .first("e10s_enabled", "e10s_enabled")
                .mean("first_paint_mean", "first_paint")
                .first("geo_subdivision1", "geo_subdivision1")
                .first("is_default_browser", "is_default_browser")
                .first("locale", "locale")
                .first("memory_mb", "memory_mb")
                .first("os", "os")
                .first("os_version", "os_version")
                .mean("places_bookmarks_count_mean", "places_bookmarks_count")
                .mean("places_pages_count_mean", "places_pages_count")
                .max("profile_subsession_counter_max", "profile_subsession_counter")
                .sum("push_api_notify_sum", "push_api_notify")
                .max("scalar_parent_browser_engagement_max_concurrent_tab_count_max",
                        "scalar_parent_browser_engagement_max_concurrent_tab_count")
                .max("scalar_parent_browser_engagement_max_concurrent_window_count_max",
                        "scalar_parent_browser_engagement_max_concurrent_window_count")
                .sum("scalar_parent_browser_engagement_tab_open_event_count_sum",
                        "scalar_parent_browser_engagement_tab_open_event_count")
                .sum("scalar_parent_browser_engagement_total_uri_count_sum",
                        "scalar_parent_browser_engagement_total_uri_count")
                .max("scalar_parent_browser_engagement_unique_domains_count_max",
                        "scalar_parent_browser_engagement_unique_domains_count")
                .mean("scalar_parent_browser_engagement_unique_domains_count_mean",
                        "scalar_parent_browser_engagement_unique_domains_count")
                .sum("scalar_parent_browser_engagement_window_open_event_count_sum",
                        "scalar_parent_browser_engagement_window_open_event_count");

        for (String column : SearchCountExtractor.derivedColumns()) {
            builder.sum(column + "_sum", column);
        }

        return builder
                .count(ClientDayAggregate.SESSIONS_STARTED_ON_THIS_DAY, ClientDayGrouping.SESSION_STARTED_ON_ACTIVITY_DATE)
                .sum("subsession_length_sum", "subsession_length")
                .mean("sync_count_desktop_mean", "sync_count_desktop")
                .mean("sync_count_mobile_mean", "sync_count_mobile")
                .first("sync_configured", "sync_configured")
                .build();
    }

    public List<AggregationSpec> specs() {
        return specs;
    }

    public int size() {
        return specs.size();
    }

    /**
     * @throws SchemaViolationException on the first entry whose source column is missing or of a
     *                                  type its kind cannot aggregate
     */
    public void validate(PingSchema schema) {
        for (AggregationSpec spec : specs) {
            ColumnType type = schema.typeOf(spec.sourceColumn());
            if (type == null) {
                throw new SchemaViolationException("Rollup column '" + spec.outputColumn()
                        + "' reads missing column '" + spec.sourceColumn() + "'");
            }
            if (!spec.kind().supports(type)) {
                throw new SchemaViolationException("Rollup column '" + spec.outputColumn() + "' applies "
                        + spec.kind() + " to " + type + " column '" + spec.sourceColumn() + "'");
            }
        }
    }

    public static final class Builder {

        private final List<AggregationSpec> specs = new ArrayList<>();
        private final Set<String> outputs = new HashSet<>();

        private Builder() {
        }

        public Builder add(String outputColumn, String sourceColumn, AggregationKind kind) {
            if (!outputs.add(outputColumn)) {
                throw new SchemaViolationException("Rollup column '" + outputColumn + "' declared twice");
            }
            specs.add(new AggregationSpec(outputColumn, sourceColumn, kind));
            return this;
        }

        public Builder sum(String outputColumn, String sourceColumn) {
            return add(outputColumn, sourceColumn, AggregationKind.SUM);
        }

        public Builder mean(String outputColumn, String sourceColumn) {
            return add(outputColumn, sourceColumn, AggregationKind.MEAN);
        }

        public Builder max(String outputColumn, String sourceColumn) {
            return add(outputColumn, sourceColumn, AggregationKind.MAX);
        }

        public Builder first(String outputColumn, String sourceColumn) {
            return add(outputColumn, sourceColumn, AggregationKind.FIRST_SKIP_NULL);
        }

        public Builder count(String outputColumn, String sourceColumn) {
            return add(outputColumn, sourceColumn, AggregationKind.COUNT);
        }

        public AggregationSpecRegistry build() {
            return new AggregationSpecRegistry(specs);
        }
    }
}
