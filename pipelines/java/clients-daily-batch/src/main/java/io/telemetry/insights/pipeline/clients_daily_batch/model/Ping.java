package io.telemetry.insights.pipeline.clients_daily_batch.model;

import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Telemetry columns hold no null entries, so an absent column and a null column compare equal.
 */
public record Ping(
        String clientId,
        @Nullable String documentId,
        OffsetDateTime subsessionStartDate,
        @Nullable OffsetDateTime sessionStartDate,
        @Nullable Long profileCreationDate,
        @Nullable List<SearchCount> searchCounts,
        Map<String, Object> fields
) {

    public static final String CLIENT_ID = "client_id";
    public static final String DOCUMENT_ID = "document_id";
    public static final String SUBSESSION_START_DATE = "subsession_start_date";
    public static final String SESSION_START_DATE = "session_start_date";
    public static final String PROFILE_CREATION_DATE = "profile_creation_date";
    public static final String SEARCH_COUNTS = "search_counts";

    // ties on the start instant are broken on content, so the order is total
    public static final Comparator<Ping> CHRONOLOGICAL = Comparator
            .comparing((Ping ping) -> ping.subsessionStartDate().toInstant())
            .thenComparing(Ping::documentId, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(ping -> ping.fields().toString())
            .thenComparing(ping -> String.valueOf(ping.searchCounts()))
            .thenComparing(ping -> String.valueOf(ping.sessionStartDate()))
            .thenComparing(ping -> String.valueOf(ping.profileCreationDate()));

    public Ping {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(subsessionStartDate, "subsessionStartDate");
        searchCounts = searchCounts == null ? null : List.copyOf(searchCounts);
        fields = normalize(fields);
    }

    public @Nullable Object value(String column) {
        switch (column) {
            case CLIENT_ID:
                return clientId;
            case DOCUMENT_ID:
                return documentId;
            case SUBSESSION_START_DATE:
                return subsessionStartDate;
            case SESSION_START_DATE:
                return sessionStartDate;
            case PROFILE_CREATION_DATE:
                return profileCreationDate;
            case SEARCH_COUNTS:
                return searchCounts;
            default:
                return fields.get(column);
        }
    }

    public Ping withField(String column, @Nullable Object value) {
        Map<String, Object> updated = new TreeMap<>(fields);
        if (value == null) {
            updated.remove(column);
        } else {
            updated.put(column, value);
        }
        return new Ping(clientId, documentId, subsessionStartDate, sessionStartDate, profileCreationDate,
                searchCounts, updated);
    }

    public Ping withFields(Map<String, ?> extra) {
        Map<String, Object> updated = new TreeMap<>(fields);
        updated.putAll(extra);
        return new Ping(clientId, documentId, subsessionStartDate, sessionStartDate, profileCreationDate,
                searchCounts, updated);
    }

    private static Map<String, Object> normalize(@Nullable Map<String, ?> raw) {
        TreeMap<String, Object> sorted = new TreeMap<>();
        if (raw != null) {
            raw.forEach((name, value) -> {
                if (value != null) {
                    sorted.put(name, widen(value));
                }
            });
        }
        return Collections.unmodifiableMap(sorted);
    }

    private static Object widen(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        return value;
    }
}
