package io.telemetry.insights.pipeline.clients_daily_batch.rollup;

import io.telemetry.insights.pipeline.clients_daily_batch.model.ClientDayAggregate;
import io.telemetry.insights.pipeline.clients_daily_batch.model.ClientDayKey;
import io.telemetry.insights.pipeline.clients_daily_batch.model.ColumnType;
import io.telemetry.insights.pipeline.clients_daily_batch.model.Ping;
import io.telemetry.insights.pipeline.clients_daily_batch.model.PingSchema;
import io.telemetry.insights.pipeline.clients_daily_batch.rollup.ProfileAgeCalculator.ProfileAge;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ClientDayAggregator {

    private final List<TypedSpec> specs;
    private final ProfileAgeCalculator profileAgeCalculator;

    public ClientDayAggregator(AggregationSpecRegistry registry, PingSchema schema,
                               ProfileAgeCalculator profileAgeCalculator) {
        registry.validate(schema);
        List<TypedSpec> typed = new ArrayList<>(registry.size());
        for (AggregationSpec spec : registry.specs()) {
            typed.add(new TypedSpec(spec, schema.require(spec.sourceColumn())));
        }
        this.specs = List.copyOf(typed);
        this.profileAgeCalculator = profileAgeCalculator;
    }

    public ClientDayAggregate aggregate(ClientDayKey key, List<Ping> pings) {
        Map<String, @Nullable Object> columns = new LinkedHashMap<>();
        for (TypedSpec typed : specs) {
            columns.put(typed.spec().outputColumn(), AggregationEvaluator.evaluate(typed.spec(), typed.type(), pings));
        }

        Long creationDayCount = firstCreationDayCount(pings);
        ProfileAge profileAge = profileAgeCalculator.calculate(creationDayCount, key.activityDate());

        return new ClientDayAggregate(
                key.clientId(),
                key.activityDate(),
                columns,
                pings.size(),
                profileAge.creationDate(),
                profileAge.ageInDays()
        );
    }

    // negative day counts are placeholders
    private static @Nullable Long firstCreationDayCount(List<Ping> pings) {
        for (Ping ping : pings) {
            Long dayCount = ping.profileCreationDate();
            if (dayCount != null && dayCount >= 0) {
                return dayCount;
            }
        }
        return null;
    }

    private record TypedSpec(AggregationSpec spec, ColumnType type) {
    }
}
