package io.telemetry.insights.pipeline.clients_daily_batch.model;

import org.jspecify.annotations.Nullable;

public record SearchCount(
        @Nullable String engine,
        @Nullable String source,
        @Nullable Long count
) {
}
