package io.telemetry.insights.pipeline.clients_daily_batch.tasklet;

import io.telemetry.insights.pipeline.clients_daily_batch.exception.SchemaViolationException;
import io.telemetry.insights.pipeline.clients_daily_batch.model.ColumnType;
import io.telemetry.insights.pipeline.clients_daily_batch.model.Ping;
import io.telemetry.insights.pipeline.clients_daily_batch.model.PingSchema;
import io.telemetry.insights.pipeline.clients_daily_batch.reader.MainSummaryReaders;
import io.telemetry.insights.pipeline.clients_daily_batch.rollup.AggregationSpecRegistry;
import io.telemetry.insights.pipeline.clients_daily_batch.rollup.ClientsDailyRollup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.ResultSetMetaData;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public class SchemaValidationTasklet implements Tasklet {

    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaValidationTasklet.class);

    private static final String SQL_TABLE_SHAPE =
            "SELECT * FROM " + MainSummaryReaders.TABLE + " WHERE 1 = 0";

    private static final Map<String, ColumnType> IDENTITY_COLUMNS = new LinkedHashMap<>();

    static {
        IDENTITY_COLUMNS.put(Ping.CLIENT_ID, ColumnType.STRING);
        IDENTITY_COLUMNS.put(Ping.DOCUMENT_ID, ColumnType.STRING);
        IDENTITY_COLUMNS.put(Ping.SUBSESSION_START_DATE, ColumnType.STRING);
        IDENTITY_COLUMNS.put(Ping.SESSION_START_DATE, ColumnType.STRING);
        IDENTITY_COLUMNS.put(Ping.PROFILE_CREATION_DATE, ColumnType.LONG);
        IDENTITY_COLUMNS.put(Ping.SEARCH_COUNTS, ColumnType.STRING);
        IDENTITY_COLUMNS.put(MainSummaryReaders.SAMPLE_ID, ColumnType.STRING);
    }

    private final JdbcTemplate jdbcTemplate;
    private final PingSchema schema;
    private final AggregationSpecRegistry registry;

    public SchemaValidationTasklet(DataSource dataSource, PingSchema schema, AggregationSpecRegistry registry) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.schema = schema;
        this.registry = registry;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        Map<String, Integer> tableColumns = readTableColumns();

        if (!tableColumns.containsKey(MainSummaryReaders.SUBMISSION_DATE)) {
            throw new SchemaViolationException(MainSummaryReaders.TABLE + " has no column "
                    + MainSummaryReaders.SUBMISSION_DATE);
        }
        IDENTITY_COLUMNS.forEach((column, type) -> check(tableColumns, column, type));
        schema.columns().forEach((column, type) -> check(tableColumns, column, type));

        registry.validate(ClientsDailyRollup.groupedSchema(schema));

        LOGGER.info("Schema of {} matches {} ping columns and {} rollup columns.", MainSummaryReaders.TABLE,
                schema.columns().size(), registry.size());
        return RepeatStatus.FINISHED;
    }

    private Map<String, Integer> readTableColumns() {
        Map<String, Integer> columns = jdbcTemplate.query(SQL_TABLE_SHAPE, resultSet -> {
            ResultSetMetaData metaData = resultSet.getMetaData();
            Map<String, Integer> types = new HashMap<>();
            for (int i = 1; i <= metaData.getColumnCount(); i++) {
                types.put(metaData.getColumnLabel(i).toLowerCase(Locale.ROOT), metaData.getColumnType(i));
            }
            return types;
        });
        if (columns == null) {
            throw new SchemaViolationException("Could not read the columns of " + MainSummaryReaders.TABLE);
        }
        return columns;
    }

    private static void check(Map<String, Integer> tableColumns, String column, ColumnType expected) {
        Integer sqlType = tableColumns.get(column);
        if (sqlType == null) {
            throw new SchemaViolationException(MainSummaryReaders.TABLE + " has no column " + column);
        }
        if (!expected.acceptsSqlType(sqlType)) {
            throw new SchemaViolationException(MainSummaryReaders.TABLE + "." + column + " has SQL type "
                    + sqlType + ", expected a " + expected + " column");
        }
    }
}
