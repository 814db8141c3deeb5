package io.telemetry.insights.pipeline.clients_daily_batch.rollup;

public record AggregationSpec(
        String outputColumn,
        String sourceColumn,
        AggregationKind kind
) {
}
