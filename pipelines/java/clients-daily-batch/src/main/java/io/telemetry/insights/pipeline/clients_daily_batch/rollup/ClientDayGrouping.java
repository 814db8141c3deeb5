package io.telemetry.insights.pipeline.clients_daily_batch.rollup;

import io.telemetry.insights.pipeline.clients_daily_batch.model.ClientDayKey;
import io.telemetry.insights.pipeline.clients_daily_batch.model.ColumnType;
import io.telemetry.insights.pipeline.clients_daily_batch.model.Ping;
import io.telemetry.insights.pipeline.clients_daily_batch.model.PingSchema;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

public class ClientDayGrouping {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientDayGrouping.class);

    public static final String SESSION_STARTED_ON_ACTIVITY_DATE = "session_started_on_activity_date";

    private final ActivityDateConvention convention;

    public ClientDayGrouping(ActivityDateConvention convention) {
        this.convention = convention;
    }

    public static PingSchema extend(PingSchema schema) {
        return schema.withColumn(SESSION_STARTED_ON_ACTIVITY_DATE, ColumnType.BOOLEAN);
    }

    public GroupedPings group(Collection<Ping> pings) {
        Set<Ping> distinct = new LinkedHashSet<>(pings);
        int duplicates = pings.size() - distinct.size();
        if (duplicates > 0) {
            LOGGER.info("Removed {} duplicate pings out of {}", duplicates, pings.size());
        }

        SortedMap<ClientDayKey, List<Ping>> groups = new TreeMap<>();
        for (Ping ping : distinct) {
            LocalDate activityDate = convention.activityDate(ping.subsessionStartDate());
            Ping tagged = ping.withField(SESSION_STARTED_ON_ACTIVITY_DATE,
                    startedOn(ping.sessionStartDate(), activityDate));
            groups.computeIfAbsent(new ClientDayKey(ping.clientId(), activityDate), key -> new ArrayList<>())
                    .add(tagged);
        }
        for (List<Ping> group : groups.values()) {
            group.sort(Ping.CHRONOLOGICAL);
        }
        return new GroupedPings(Collections.unmodifiableSortedMap(groups), duplicates);
    }

    private boolean startedOn(@Nullable OffsetDateTime sessionStart, LocalDate activityDate) {
        return sessionStart != null && convention.activityDate(sessionStart).equals(activityDate);
    }

    public record GroupedPings(SortedMap<ClientDayKey, List<Ping>> groups, int duplicatesRemoved) {

        public int pingCount() {
            int count = 0;
            for (Map.Entry<ClientDayKey, List<Ping>> entry : groups.entrySet()) {
                count += entry.getValue().size();
            }
            return count;
        }
    }
}
