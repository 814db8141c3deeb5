package io.telemetry.insights.pipeline.clients_daily_batch.writer;

import io.telemetry.insights.pipeline.clients_daily_batch.exception.RollupFailedException;
import io.telemetry.insights.pipeline.clients_daily_batch.model.ClientDayAggregate;
import io.telemetry.insights.pipeline.clients_daily_batch.rollup.AggregationSpec;
import io.telemetry.insights.pipeline.clients_daily_batch.rollup.AggregationSpecRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.database.JdbcBatchItemWriter;
import org.springframework.batch.infrastructure.item.database.builder.JdbcBatchItemWriterBuilder;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public class ClientsDailyWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientsDailyWriter.class);

    public static final String TABLE = "clients_daily";
    public static final String PINGS_AGGREGATED_BY_THIS_ROW = "pings_aggregated_by_this_row";
    public static final String PROFILE_CREATION_DATE = "profile_creation_date";
    public static final String PROFILE_AGE_IN_DAYS = "profile_age_in_days";

    private static final String SQL_DELETE_DAY = "DELETE FROM " + TABLE + " WHERE activity_date = ?";

    private final AggregationSpecRegistry registry;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final JdbcBatchItemWriter<ClientDayAggregate> delegateWriter;

    public ClientsDailyWriter(DataSource dataSource,
                              PlatformTransactionManager transactionManager,
                              AggregationSpecRegistry registry) {
        this.registry = registry;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.delegateWriter = createDelegateWriter(dataSource);
    }

    private JdbcBatchItemWriter<ClientDayAggregate> createDelegateWriter(DataSource dataSource) {
        List<String> columns = new ArrayList<>();
        columns.add("client_id");
        columns.add("activity_date");
        for (AggregationSpec spec : registry.specs()) {
            columns.add(spec.outputColumn());
        }
        columns.add(PINGS_AGGREGATED_BY_THIS_ROW);
        columns.add(PROFILE_CREATION_DATE);
        columns.add(PROFILE_AGE_IN_DAYS);

        List<String> parameters = new ArrayList<>();
        for (String column : columns) {
            parameters.add(":" + column);
        }

        final String SQL_INSERT =
                "INSERT INTO " + TABLE + " (" + String.join(", ", columns) + ") " +
                        "VALUES (" + String.join(", ", parameters) + ")";

        return new JdbcBatchItemWriterBuilder<ClientDayAggregate>()
                .itemSqlParameterSourceProvider(this::parameters)
                .sql(SQL_INSERT)
                .dataSource(dataSource)
                .build();
    }

    private MapSqlParameterSource parameters(ClientDayAggregate row) {
        MapSqlParameterSource source = new MapSqlParameterSource()
                .addValue("client_id", row.clientId())
                .addValue("activity_date", row.activityDate());
        for (AggregationSpec spec : registry.specs()) {
            source.addValue(spec.outputColumn(), row.get(spec.outputColumn()));
        }
        return source
                .addValue(PINGS_AGGREGATED_BY_THIS_ROW, row.pingsAggregatedByThisRow())
                .addValue(PROFILE_CREATION_DATE, row.profileCreationDate())
                .addValue(PROFILE_AGE_IN_DAYS, row.profileAgeInDays());
    }

    // one transaction, so a failed write leaves the previous rows of the day in place
    public void replaceActivityDay(LocalDate activityDate, List<ClientDayAggregate> rows) {
        transactionTemplate.executeWithoutResult(status -> {
            int deleted = jdbcTemplate.update(SQL_DELETE_DAY, activityDate);
            if (deleted > 0) {
                LOGGER.info("Removed {} existing client days for {}", deleted, activityDate);
            }
            if (rows.isEmpty()) {
                return;
            }
            try {
                delegateWriter.write(new Chunk<>(rows));
            } catch (Exception e) {
                throw new RollupFailedException("Could not write client days for " + activityDate, e);
            }
        });
        LOGGER.info("Wrote {} client days for {}", rows.size(), activityDate);
    }
}
