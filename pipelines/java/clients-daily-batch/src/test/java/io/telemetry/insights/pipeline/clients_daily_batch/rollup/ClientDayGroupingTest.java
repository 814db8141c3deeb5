package io.telemetry.insights.pipeline.clients_daily_batch.rollup;

import io.telemetry.insights.pipeline.clients_daily_batch.model.ClientDayKey;
import io.telemetry.insights.pipeline.clients_daily_batch.model.Ping;
import io.telemetry.insights.pipeline.clients_daily_batch.rollup.ClientDayGrouping.GroupedPings;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static io.telemetry.insights.pipeline.clients_daily_batch.PingFixtures.CLIENT_A;
import static io.telemetry.insights.pipeline.clients_daily_batch.PingFixtures.CLIENT_B;
import static io.telemetry.insights.pipeline.clients_daily_batch.PingFixtures.ping;
import static org.junit.jupiter.api.Assertions.*;

class ClientDayGroupingTest {

    private static final LocalDate MAY_25 = LocalDate.of(2017, 5, 25);
    private static final LocalDate MAY_26 = LocalDate.of(2017, 5, 26);

    private final ClientDayGrouping utc = new ClientDayGrouping(ActivityDateConvention.utc());

    @Test
    void testGroup_ExactDuplicateCollapsed() {
        Ping first = ping(CLIENT_A, "2017-05-25T08:00:00.0+00:00").field("crashes_detected_content", 1L).extracted();
        Ping second = ping(CLIENT_A, "2017-05-25T09:00:00.0+00:00").field("crashes_detected_content", 2L).extracted();

        GroupedPings grouped = utc.group(List.of(first, second, first));

        assertEquals(1, grouped.duplicatesRemoved());
        assertEquals(2, grouped.groups().get(new ClientDayKey(CLIENT_A, MAY_25)).size());
    }

    @Test
    void testGroup_SameDocumentDifferentContent_NotADuplicate() {
        Ping first = ping(CLIENT_A, "2017-05-25T08:00:00.0+00:00").documentId("doc-1").field("os", "Linux").build();
        Ping edited = ping(CLIENT_A, "2017-05-25T08:00:00.0+00:00").documentId("doc-1").field("os", "Darwin").build();

        GroupedPings grouped = utc.group(List.of(first, edited));

        assertEquals(0, grouped.duplicatesRemoved());
        assertEquals(2, grouped.pingCount());
    }

    @Test
    void testGroup_KeysByClientAndActivityDate() {
        List<Ping> pings = List.of(
                ping(CLIENT_B, "2017-05-25T08:00:00.0+00:00").build(),
                ping(CLIENT_A, "2017-05-26T01:00:00.0+00:00").build(),
                ping(CLIENT_A, "2017-05-25T22:00:00.0+00:00").build(),
                ping(CLIENT_A, "2017-05-25T21:00:00.0-04:00").build()
        );

        GroupedPings grouped = utc.group(pings);

        // 21:00 at -04:00 is 01:00 UTC on the 26th
        assertEquals(List.of(
                new ClientDayKey(CLIENT_A, MAY_25),
                new ClientDayKey(CLIENT_B, MAY_25),
                new ClientDayKey(CLIENT_A, MAY_26)
        ), new ArrayList<>(grouped.groups().keySet()));
        assertEquals(2, grouped.groups().get(new ClientDayKey(CLIENT_A, MAY_26)).size());
    }

    @Test
    void testGroup_ZoneMovesDayBoundary() {
        ClientDayGrouping newYork = new ClientDayGrouping(ActivityDateConvention.of("America/New_York"));
        Ping ping = ping(CLIENT_A, "2017-05-26T01:00:00.0+00:00").build();

        assertTrue(newYork.group(List.of(ping)).groups().containsKey(new ClientDayKey(CLIENT_A, MAY_25)));
        assertTrue(utc.group(List.of(ping)).groups().containsKey(new ClientDayKey(CLIENT_A, MAY_26)));
    }

    @Test
    void testGroup_PingsSortedChronologically() {
        Ping late = ping(CLIENT_A, "2017-05-25T20:00:00.0+00:00").build();
        Ping early = ping(CLIENT_A, "2017-05-25T02:00:00.0+00:00").build();

        List<Ping> group = utc.group(List.of(late, early)).groups().get(new ClientDayKey(CLIENT_A, MAY_25));

        assertEquals(early.subsessionStartDate(), group.get(0).subsessionStartDate());
        assertEquals(late.subsessionStartDate(), group.get(1).subsessionStartDate());
    }

    @Test
    void testGroup_TagsSessionsStartedOnActivityDate() {
        Ping startedToday = ping(CLIENT_A, "2017-05-25T10:00:00.0+00:00")
                .sessionStart("2017-05-25T09:00:00.0+00:00").build();
        Ping startedYesterday = ping(CLIENT_A, "2017-05-25T11:00:00.0+00:00")
                .sessionStart("2017-05-24T23:00:00.0+00:00").build();
        Ping unknownStart = ping(CLIENT_A, "2017-05-25T12:00:00.0+00:00").build();

        List<Ping> group = utc.group(List.of(startedToday, startedYesterday, unknownStart))
                .groups().get(new ClientDayKey(CLIENT_A, MAY_25));

        assertEquals(Boolean.TRUE, group.get(0).value(ClientDayGrouping.SESSION_STARTED_ON_ACTIVITY_DATE));
        assertEquals(Boolean.FALSE, group.get(1).value(ClientDayGrouping.SESSION_STARTED_ON_ACTIVITY_DATE));
        assertEquals(Boolean.FALSE, group.get(2).value(ClientDayGrouping.SESSION_STARTED_ON_ACTIVITY_DATE));
    }
}
