package io.telemetry.insights.pipeline.clients_daily_batch.rollup;

import io.telemetry.insights.pipeline.clients_daily_batch.model.ColumnType;
import io.telemetry.insights.pipeline.clients_daily_batch.model.Ping;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.telemetry.insights.pipeline.clients_daily_batch.PingFixtures.CLIENT_A;
import static io.telemetry.insights.pipeline.clients_daily_batch.PingFixtures.ping;
import static org.junit.jupiter.api.Assertions.*;

class AggregationEvaluatorTest {

    private static Object evaluate(AggregationKind kind, String column, ColumnType type, List<Ping> pings) {
        return AggregationEvaluator.evaluate(new AggregationSpec("out", column, kind), type, pings);
    }

    private static List<Ping> pings(String column, Object... values) {
        List<Ping> pings = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            pings.add(ping(CLIENT_A, "2017-05-25T0" + i + ":00:00.0+00:00").field(column, values[i]).build());
        }
        pings.sort(Ping.CHRONOLOGICAL);
        return pings;
    }

    @Test
    void testSum_SkipsNulls() {
        assertEquals(6L, evaluate(AggregationKind.SUM, "c", ColumnType.LONG, pings("c", 1L, null, 5L)));
    }

    @Test
    void testSum_DoubleColumn() {
        assertEquals(3.75, evaluate(AggregationKind.SUM, "c", ColumnType.DOUBLE, pings("c", 1.5, 2.25)));
    }

    @Test
    void testSum_AllNull_IsNull() {
        assertNull(evaluate(AggregationKind.SUM, "c", ColumnType.LONG, pings("c", null, null)));
    }

    @Test
    void testMean_DenominatorCountsOnlyNonNull() {
        assertEquals(150.0, evaluate(AggregationKind.MEAN, "c", ColumnType.LONG, pings("c", 100L, null, 200L)));
    }

    @Test
    void testMean_AllNull_IsNull() {
        assertNull(evaluate(AggregationKind.MEAN, "c", ColumnType.LONG, pings("c", (Object) null)));
    }

    @Test
    void testMax_PreservesType() {
        assertEquals(9L, evaluate(AggregationKind.MAX, "c", ColumnType.LONG, pings("c", 3L, 9L, null, 4L)));
        assertEquals(2.5, evaluate(AggregationKind.MAX, "c", ColumnType.DOUBLE, pings("c", 2.5, -1.0)));
        assertNull(evaluate(AggregationKind.MAX, "c", ColumnType.LONG, pings("c", null, null)));
    }

    @Test
    void testFirstSkipNull_NullThenFalse_IsFalse() {
        assertEquals(Boolean.FALSE,
                evaluate(AggregationKind.FIRST_SKIP_NULL, "sync_configured", ColumnType.BOOLEAN,
                        pings("sync_configured", null, false)));
    }

    @Test
    void testFirstSkipNull_TakesChronologicallyFirstNonNull() {
        assertEquals("Linux",
                evaluate(AggregationKind.FIRST_SKIP_NULL, "os", ColumnType.STRING,
                        pings("os", null, "Linux", "Windows_NT")));
    }

    @Test
    void testFirstSkipNull_AllNull_IsNull() {
        assertNull(evaluate(AggregationKind.FIRST_SKIP_NULL, "sync_configured", ColumnType.BOOLEAN,
                pings("sync_configured", null, null, null)));
    }

    @Test
    void testCount_BooleanCountsTrueOnly() {
        assertEquals(2L, evaluate(AggregationKind.COUNT, "flag", ColumnType.BOOLEAN,
                pings("flag", true, false, null, true)));
    }

    @Test
    void testCount_OtherTypesCountNonNull() {
        assertEquals(2L, evaluate(AggregationKind.COUNT, "os", ColumnType.STRING, pings("os", "Linux", null, "Darwin")));
    }
}
