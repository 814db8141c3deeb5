package io.telemetry.insights.pipeline.clients_daily_batch.model;

import org.jspecify.annotations.Nullable;

import java.util.Map;

public record RawPing(
        @Nullable String clientId,
        @Nullable String documentId,
        @Nullable String subsessionStartDate,
        @Nullable String sessionStartDate,
        @Nullable Long profileCreationDate,
        @Nullable String searchCounts,
        Map<String, @Nullable Object> fields
) {
}
