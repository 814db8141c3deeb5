package io.telemetry.insights.pipeline.clients_daily_batch.rollup;

import io.telemetry.insights.pipeline.clients_daily_batch.exception.RollupFailedException;
import io.telemetry.insights.pipeline.clients_daily_batch.model.ClientDayAggregate;
import io.telemetry.insights.pipeline.clients_daily_batch.model.ClientDayKey;
import io.telemetry.insights.pipeline.clients_daily_batch.model.Ping;
import io.telemetry.insights.pipeline.clients_daily_batch.model.PingSchema;
import io.telemetry.insights.pipeline.clients_daily_batch.rollup.ClientDayGrouping.GroupedPings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Predicate;
import java.util.stream.Collectors;

public class ClientsDailyRollup {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientsDailyRollup.class);

    private final ClientDayGrouping grouping;
    private final ClientDayAggregator aggregator;
    private final int parallelism;

    public ClientsDailyRollup(PingSchema inputSchema,
                              AggregationSpecRegistry registry,
                              ActivityDateConvention convention,
                              NegativeProfileAgePolicy negativeAgePolicy,
                              int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        this.grouping = new ClientDayGrouping(convention);
        this.aggregator = new ClientDayAggregator(registry, groupedSchema(inputSchema),
                new ProfileAgeCalculator(convention, negativeAgePolicy));
        this.parallelism = parallelism;
    }

    public static PingSchema groupedSchema(PingSchema inputSchema) {
        return ClientDayGrouping.extend(SearchCountExtractor.extend(inputSchema));
    }

    public List<ClientDayAggregate> rollup(Collection<Ping> pings) {
        return rollup(pings, date -> true);
    }

    /**
     * Rolls up only the groups whose activity date is {@code activityDate}.
     */
    public List<ClientDayAggregate> rollup(Collection<Ping> pings, LocalDate activityDate) {
        return rollup(pings, activityDate::equals);
    }

    private List<ClientDayAggregate> rollup(Collection<Ping> pings, Predicate<LocalDate> activityDates) {
        GroupedPings grouped = grouping.group(pings);
        List<Map.Entry<ClientDayKey, List<Ping>>> selected = new ArrayList<>();
        for (Map.Entry<ClientDayKey, List<Ping>> entry : grouped.groups().entrySet()) {
            if (activityDates.test(entry.getKey().activityDate())) {
                selected.add(entry);
            }
        }
        LOGGER.info("Aggregating {} client days out of {} from {} distinct pings", selected.size(),
                grouped.groups().size(), grouped.pingCount());

        if (parallelism == 1 || selected.size() < 2) {
            return selected.stream()
                    .map(entry -> aggregator.aggregate(entry.getKey(), entry.getValue()))
                    .collect(Collectors.toList());
        }

        ForkJoinPool pool = new ForkJoinPool(parallelism);
        try {
            return pool.submit(() -> selected.parallelStream()
                            .map(entry -> aggregator.aggregate(entry.getKey(), entry.getValue()))
                            .collect(Collectors.toList()))
                    .get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RollupFailedException("Interrupted while aggregating client days", e);
        } catch (ExecutionException e) {
            throw new RollupFailedException("Aggregation of client days failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }
}
