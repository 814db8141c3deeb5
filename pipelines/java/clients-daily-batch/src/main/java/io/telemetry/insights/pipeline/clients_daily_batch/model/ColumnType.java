package io.telemetry.insights.pipeline.clients_daily_batch.model;

import java.sql.Types;
import java.util.Set;

public enum ColumnType {
    LONG(Set.of(Types.BIGINT, Types.INTEGER, Types.SMALLINT, Types.TINYINT)),
    DOUBLE(Set.of(Types.DOUBLE, Types.FLOAT, Types.REAL, Types.DECIMAL, Types.NUMERIC)),
    BOOLEAN(Set.of(Types.BOOLEAN, Types.BIT)),
    STRING(Set.of(Types.VARCHAR, Types.CHAR, Types.LONGVARCHAR, Types.NVARCHAR, Types.CLOB));

    private final Set<Integer> sqlTypes;

    ColumnType(Set<Integer> sqlTypes) {
        this.sqlTypes = sqlTypes;
    }

    public boolean isNumeric() {
        return this == LONG || this == DOUBLE;
    }

    public boolean acceptsSqlType(int sqlType) {
        return sqlTypes.contains(sqlType);
    }
}
