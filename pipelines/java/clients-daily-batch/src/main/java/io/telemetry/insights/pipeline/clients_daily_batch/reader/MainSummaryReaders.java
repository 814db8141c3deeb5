package io.telemetry.insights.pipeline.clients_daily_batch.reader;

import io.telemetry.insights.pipeline.clients_daily_batch.model.Ping;
import io.telemetry.insights.pipeline.clients_daily_batch.model.PingSchema;
import io.telemetry.insights.pipeline.clients_daily_batch.model.RawPing;
import org.jspecify.annotations.Nullable;
import org.springframework.batch.infrastructure.item.database.JdbcCursorItemReader;
import org.springframework.batch.infrastructure.item.database.builder.JdbcCursorItemReaderBuilder;

import javax.sql.DataSource;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public final class MainSummaryReaders {

    public static final String TABLE = "main_summary";
    public static final String SUBMISSION_DATE = "submission_date";
    public static final String SAMPLE_ID = "sample_id";

    static final List<String> IDENTITY_COLUMNS = List.of(
            Ping.CLIENT_ID,
            Ping.DOCUMENT_ID,
            Ping.SUBSESSION_START_DATE,
            Ping.SESSION_START_DATE,
            Ping.PROFILE_CREATION_DATE,
            Ping.SEARCH_COUNTS
    );

    private static final int FETCH_SIZE = 1000;

    private MainSummaryReaders() {
    }

    public static JdbcCursorItemReader<RawPing> forActivityDay(DataSource dataSource,
                                                               PingSchema schema,
                                                               LocalDate activityDate,
                                                               int lagDays,
                                                               @Nullable String sampleId) {
        List<Object> arguments = new ArrayList<>();
        // east of UTC a local day starts on the previous UTC day
        arguments.add(activityDate.minusDays(1));
        arguments.add(activityDate.plusDays(lagDays));
        if (sampleId != null && !sampleId.isBlank()) {
            arguments.add(sampleId);
        }

        return new JdbcCursorItemReaderBuilder<RawPing>()
                .name("mainSummaryReader")
                .dataSource(dataSource)
                .sql(query(schema, arguments.size() > 2))
                .rowMapper(new MainSummaryRowMapper(schema))
                .fetchSize(FETCH_SIZE)
                .queryArguments(arguments.toArray())
                .build();
    }

    static String query(PingSchema schema, boolean filterOnSample) {
        List<String> columns = new ArrayList<>(IDENTITY_COLUMNS);
        columns.addAll(schema.columns().keySet());

        StringBuilder sql = new StringBuilder("SELECT ")
                .append(String.join(", ", columns))
                .append(" FROM ").append(TABLE)
                .append(" WHERE ").append(SUBMISSION_DATE).append(" >= ?")
                .append(" AND ").append(SUBMISSION_DATE).append(" <= ?");
        if (filterOnSample) {
            sql.append(" AND ").append(SAMPLE_ID).append(" = ?");
        }
        return sql.append(" ORDER BY ").append(Ping.CLIENT_ID).append(", ").append(Ping.DOCUMENT_ID).toString();
    }
}
