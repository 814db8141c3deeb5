package io.telemetry.insights.pipeline.clients_daily_batch.rollup;

import io.telemetry.insights.pipeline.clients_daily_batch.model.ColumnType;

public enum AggregationKind {
    SUM(true),
    MEAN(true),
    MAX(true),
    FIRST_SKIP_NULL(false),
    COUNT(false);

    private final boolean numericOnly;

    AggregationKind(boolean numericOnly) {
        this.numericOnly = numericOnly;
    }

    public boolean supports(ColumnType type) {
        return !numericOnly || type.isNumeric();
    }
}
