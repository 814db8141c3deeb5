package io.telemetry.insights.pipeline.clients_daily_batch.rollup;

import io.telemetry.insights.pipeline.clients_daily_batch.model.ColumnType;
import io.telemetry.insights.pipeline.clients_daily_batch.model.Ping;
import org.jspecify.annotations.Nullable;

import java.util.List;

public final class AggregationEvaluator {

    private AggregationEvaluator() {
    }

    public static @Nullable Object evaluate(AggregationSpec spec, ColumnType type, List<Ping> pings) {
        String column = spec.sourceColumn();
        switch (spec.kind()) {
            case SUM:
                return sum(column, type, pings);
            case MEAN:
                return mean(column, pings);
            case MAX:
                return max(column, type, pings);
            case FIRST_SKIP_NULL:
                return firstSkipNull(column, pings);
            case COUNT:
                return count(column, pings);
            default:
                throw new IllegalArgumentException("Unsupported aggregation " + spec.kind());
        }
    }

    private static @Nullable Object sum(String column, ColumnType type, List<Ping> pings) {
        long longSum = 0L;
        double doubleSum = 0d;
        boolean seen = false;
        for (Ping ping : pings) {
            Object value = ping.value(column);
            if (value == null) {
                continue;
            }
            seen = true;
            if (type == ColumnType.LONG) {
                longSum = Math.addExact(longSum, ((Number) value).longValue());
            } else {
                doubleSum += ((Number) value).doubleValue();
            }
        }
        if (!seen) {
            return null;
        }
        return type == ColumnType.LONG ? (Object) longSum : (Object) doubleSum;
    }

    private static @Nullable Double mean(String column, List<Ping> pings) {
        double total = 0d;
        long count = 0L;
        for (Ping ping : pings) {
            Object value = ping.value(column);
            if (value != null) {
                total += ((Number) value).doubleValue();
                count++;
            }
        }
        return count == 0 ? null : total / count;
    }

    private static @Nullable Object max(String column, ColumnType type, List<Ping> pings) {
        Number best = null;
        for (Ping ping : pings) {
            Number value = (Number) ping.value(column);
            if (value == null) {
                continue;
            }
            if (best == null) {
                best = value;
            } else if (type == ColumnType.LONG) {
                best = Math.max(best.longValue(), value.longValue());
            } else {
                best = Math.max(best.doubleValue(), value.doubleValue());
            }
        }
        return best;
    }

    private static @Nullable Object firstSkipNull(String column, List<Ping> pings) {
        for (Ping ping : pings) {
            Object value = ping.value(column);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static long count(String column, List<Ping> pings) {
        long count = 0L;
        for (Ping ping : pings) {
            Object value = ping.value(column);
            if (value instanceof Boolean ? (Boolean) value : value != null) {
                count++;
            }
        }
        return count;
    }
}
