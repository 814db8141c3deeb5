package io.telemetry.insights.pipeline.clients_daily_batch.rollup;

import io.telemetry.insights.pipeline.clients_daily_batch.model.ColumnType;
import io.telemetry.insights.pipeline.clients_daily_batch.model.Ping;
import io.telemetry.insights.pipeline.clients_daily_batch.model.PingSchema;
import io.telemetry.insights.pipeline.clients_daily_batch.model.SearchCount;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class SearchCountExtractor {

    public static final List<String> SEARCH_ACCESS_POINTS =
            List.of("abouthome", "contextmenu", "newtab", "searchbar", "system", "urlbar");

    public static final String SEARCH_COUNT_ALL = "search_count_all";

    private static final String PREFIX = "search_count_";

    private static final List<String> DERIVED_COLUMNS;

    static {
        List<String> columns = new ArrayList<>();
        for (String point : SEARCH_ACCESS_POINTS) {
            columns.add(PREFIX + point);
        }
        columns.add(SEARCH_COUNT_ALL);
        DERIVED_COLUMNS = Collections.unmodifiableList(columns);
    }

    private SearchCountExtractor() {
    }

    public static List<String> derivedColumns() {
        return DERIVED_COLUMNS;
    }

    public static Ping extract(Ping ping) {
        return ping.withFields(searchCounts(ping.searchCounts()));
    }

    public static Map<String, Long> searchCounts(@Nullable List<SearchCount> searchCounts) {
        Map<String, Long> perPoint = new LinkedHashMap<>();
        for (String point : SEARCH_ACCESS_POINTS) {
            perPoint.put(point, 0L);
        }
        if (searchCounts != null) {
            for (SearchCount entry : searchCounts) {
                if (entry == null || entry.count() == null || entry.count() < 0
                        || !perPoint.containsKey(entry.source())) {
                    continue;
                }
                perPoint.merge(entry.source(), entry.count(), Long::sum);
            }
        }

        Map<String, Long> derived = new LinkedHashMap<>();
        long all = 0L;
        for (Map.Entry<String, Long> entry : perPoint.entrySet()) {
            derived.put(PREFIX + entry.getKey(), entry.getValue());
            all += entry.getValue();
        }
        derived.put(SEARCH_COUNT_ALL, all);
        return derived;
    }

    public static PingSchema extend(PingSchema schema) {
        PingSchema extended = schema;
        for (String column : DERIVED_COLUMNS) {
            extended = extended.withColumn(column, ColumnType.LONG);
        }
        return extended;
    }
}
