package io.telemetry.insights.pipeline.clients_daily_batch.reader;

import io.telemetry.insights.pipeline.clients_daily_batch.model.ColumnType;
import io.telemetry.insights.pipeline.clients_daily_batch.model.Ping;
import io.telemetry.insights.pipeline.clients_daily_batch.model.PingSchema;
import io.telemetry.insights.pipeline.clients_daily_batch.model.RawPing;
import org.jspecify.annotations.Nullable;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

public class MainSummaryRowMapper implements RowMapper<RawPing> {

    private final PingSchema schema;

    public MainSummaryRowMapper(PingSchema schema) {
        this.schema = schema;
    }

    @Override
    public RawPing mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        Map<String, @Nullable Object> fields = new LinkedHashMap<>();
        for (Map.Entry<String, ColumnType> column : schema.columns().entrySet()) {
            fields.put(column.getKey(), readColumn(resultSet, column.getKey(), column.getValue()));
        }
        return new RawPing(
                resultSet.getString(Ping.CLIENT_ID),
                resultSet.getString(Ping.DOCUMENT_ID),
                resultSet.getString(Ping.SUBSESSION_START_DATE),
                resultSet.getString(Ping.SESSION_START_DATE),
                nullableLong(resultSet, Ping.PROFILE_CREATION_DATE),
                resultSet.getString(Ping.SEARCH_COUNTS),
                fields
        );
    }

    private static @Nullable Object readColumn(ResultSet resultSet, String column, ColumnType type) throws SQLException {
        switch (type) {
            case LONG:
                return nullableLong(resultSet, column);
            case DOUBLE:
                double doubleValue = resultSet.getDouble(column);
                return resultSet.wasNull() ? null : doubleValue;
            case BOOLEAN:
                boolean booleanValue = resultSet.getBoolean(column);
                return resultSet.wasNull() ? null : booleanValue;
            case STRING:
                return resultSet.getString(column);
            default:
                throw new IllegalStateException("Unsupported column type " + type);
        }
    }

    private static @Nullable Long nullableLong(ResultSet resultSet, String column) throws SQLException {
        long value = resultSet.getLong(column);
        return resultSet.wasNull() ? null : value;
    }
}
