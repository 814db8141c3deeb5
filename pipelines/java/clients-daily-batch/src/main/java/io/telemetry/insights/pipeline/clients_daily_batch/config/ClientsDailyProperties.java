package io.telemetry.insights.pipeline.clients_daily_batch.config;

import io.telemetry.insights.pipeline.clients_daily_batch.rollup.NegativeProfileAgePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "clients-daily")
public record ClientsDailyProperties(
        @DefaultValue("UTC") String timezone,
        @DefaultValue("10") int lagDays,
        @DefaultValue("500") int chunkSize,
        @DefaultValue("4") int parallelism,
        @DefaultValue("NULL") NegativeProfileAgePolicy negativeProfileAge
) {
}
