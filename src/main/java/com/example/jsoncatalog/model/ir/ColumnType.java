package com.example.jsoncatalog.model.ir;

import java.sql.Types;

/**
 * Relational column type a field resolves to.
 */
public enum ColumnType {
    NUMERIC("NUMERIC", Types.NUMERIC),
    BOOLEAN("BOOLEAN", Types.BOOLEAN),
    TEXT("TEXT", Types.VARCHAR),
    SERIALIZED_TEXT("TEXT", Types.VARCHAR); // JSON text of an array or object

    private final String sqlName;
    private final int jdbcType;

    ColumnType(String sqlName, int jdbcType) {
        this.sqlName = sqlName;
        this.jdbcType = jdbcType;
    }

    public String getSqlName() {
        return sqlName;
    }

    public int getJdbcType() {
        return jdbcType;
    }

    public static ColumnType forType(JsonValueType type) {
        return switch (type) {
            case NUMBER -> NUMERIC;
            case BOOLEAN -> BOOLEAN;
            case ARRAY, OBJECT -> SERIALIZED_TEXT;
            case STRING, NULL -> TEXT;
        };
    }
}
