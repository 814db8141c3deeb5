package io.telemetry.insights.pipeline.clients_daily_batch.rollup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

public final class ActivityDateConvention {

    private static final Logger LOGGER = LoggerFactory.getLogger(ActivityDateConvention.class);

    public static final String SYSTEM = "SYSTEM";

    private static final long SECONDS_PER_DAY = 24L * 60 * 60;

    private final ZoneId zone;

    public ActivityDateConvention(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public static ActivityDateConvention utc() {
        return new ActivityDateConvention(ZoneOffset.UTC);
    }

    /**
     * Resolves a zone id, or {@code SYSTEM} for the JVM default zone at call time.
     */
    public static ActivityDateConvention of(String zoneId) {
        ZoneId zone;
        if (SYSTEM.equalsIgnoreCase(zoneId.trim())) {
            zone = ZoneId.systemDefault();
            LOGGER.info("Activity dates follow the system zone, resolved to {}", zone);
        } else {
            zone = ZoneId.of(zoneId.trim());
            LOGGER.info("Activity dates follow zone {}", zone);
        }
        return new ActivityDateConvention(zone);
    }

    public ZoneId zone() {
        return zone;
    }

    public LocalDate activityDate(OffsetDateTime timestamp) {
        return timestamp.atZoneSameInstant(zone).toLocalDate();
    }

    /**
     * Date of midnight UTC {@code days} after the epoch, seen from the zone. West of Greenwich
     * this is the previous day.
     */
    public LocalDate dateOfEpochDay(long days) {
        return Instant.ofEpochSecond(Math.multiplyExact(days, SECONDS_PER_DAY)).atZone(zone).toLocalDate();
    }

    @Override
    public String toString() {
        return "ActivityDateConvention[" + zone + "]";
    }
}
