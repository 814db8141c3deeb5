package io.telemetry.insights.pipeline.clients_daily_batch.rollup;

public enum NegativeProfileAgePolicy {
    NULL,
    KEEP
}
