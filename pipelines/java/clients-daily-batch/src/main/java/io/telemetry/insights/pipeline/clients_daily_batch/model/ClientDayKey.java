package io.telemetry.insights.pipeline.clients_daily_batch.model;

import java.time.LocalDate;
import java.util.Comparator;

public record ClientDayKey(
        String clientId,
        LocalDate activityDate
) implements Comparable<ClientDayKey> {

    private static final Comparator<ClientDayKey> ORDER = Comparator
            .comparing(ClientDayKey::activityDate)
            .thenComparing(ClientDayKey::clientId);

    @Override
    public int compareTo(ClientDayKey other) {
        return ORDER.compare(this, other);
    }
}
