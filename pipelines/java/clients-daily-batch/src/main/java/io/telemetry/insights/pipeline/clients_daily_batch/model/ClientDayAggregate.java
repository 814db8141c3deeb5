package io.telemetry.insights.pipeline.clients_daily_batch.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ClientDayAggregate(
        String clientId,
        LocalDate activityDate,
        Map<String, @Nullable Object> columns,
        long pingsAggregatedByThisRow,
        @Nullable LocalDate profileCreationDate,
        @Nullable Integer profileAgeInDays
) {

    public static final String SESSIONS_STARTED_ON_THIS_DAY = "sessions_started_on_this_day";

    public ClientDayAggregate {
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public ClientDayKey key() {
        return new ClientDayKey(clientId, activityDate);
    }

    public @Nullable Object get(String column) {
        return columns.get(column);
    }

    public long sessionsStartedOnThisDay() {
        Object value = columns.get(SESSIONS_STARTED_ON_THIS_DAY);
        return value == null ? 0L : ((Number) value).longValue();
    }
}
