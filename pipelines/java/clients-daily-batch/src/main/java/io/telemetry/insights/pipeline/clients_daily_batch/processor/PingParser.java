package io.telemetry.insights.pipeline.clients_daily_batch.processor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.telemetry.insights.pipeline.clients_daily_batch.exception.MalformedPingException;
import io.telemetry.insights.pipeline.clients_daily_batch.model.Ping;
import io.telemetry.insights.pipeline.clients_daily_batch.model.RawPing;
import io.telemetry.insights.pipeline.clients_daily_batch.model.SearchCount;
import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

public class PingParser {

    private static final TypeReference<List<SearchCount>> SEARCH_COUNTS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public PingParser() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public PingParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Ping parse(RawPing raw) throws MalformedPingException {
        String clientId = raw.clientId();
        if (clientId == null || clientId.isBlank()) {
            throw new MalformedPingException("Ping " + raw.documentId() + " has no client_id");
        }
        OffsetDateTime subsessionStart = timestamp(raw, Ping.SUBSESSION_START_DATE, raw.subsessionStartDate());
        if (subsessionStart == null) {
            throw new MalformedPingException("Ping " + raw.documentId() + " has no subsession_start_date");
        }
        OffsetDateTime sessionStart = timestamp(raw, Ping.SESSION_START_DATE, raw.sessionStartDate());

        return new Ping(
                clientId,
                raw.documentId(),
                subsessionStart,
                sessionStart,
                raw.profileCreationDate(),
                searchCounts(raw),
                raw.fields()
        );
    }

    private static @Nullable OffsetDateTime timestamp(RawPing raw, String column, @Nullable String text)
            throws MalformedPingException {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new MalformedPingException("Ping " + raw.documentId() + " has unparseable " + column
                    + " '" + text + "'", e);
        }
    }

    private @Nullable List<SearchCount> searchCounts(RawPing raw) throws MalformedPingException {
        String json = raw.searchCounts();
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, SEARCH_COUNTS);
        } catch (JsonProcessingException e) {
            throw new MalformedPingException("Ping " + raw.documentId() + " has unparseable search_counts", e);
        }
    }
}
