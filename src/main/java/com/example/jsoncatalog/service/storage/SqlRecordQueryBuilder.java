package com.example.jsoncatalog.service.storage;

import com.example.jsoncatalog.service.schema.SchemaGeneratorService;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.example.jsoncatalog.service.schema.SchemaGeneratorService.quote;

/**
 * Translates a {@link RecordQuery} into parameterized SQL. Identifiers are always quoted, values are always bound.
 */
final class SqlRecordQueryBuilder {

    record SqlStatement(String sql, List<Object> params) {
        Object[] args() {
            return params.toArray();
        }
    }

    private SqlRecordQueryBuilder() {
    }

    static SqlStatement select(String tableName, RecordQuery query) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ");
        if (query.fields().isEmpty()) {
            sql.append('*');
        } else {
            sql.append(query.fields().stream().map(SchemaGeneratorService::quote).collect(Collectors.joining(", ")));
        }
        sql.append(" FROM ").append(quote(tableName));
        appendWhere(sql, params, query.filter());

        sql.append(" ORDER BY ");
        if (query.sort().isEmpty()) {
            sql.append(quote(SchemaGeneratorService.ROW_ID_COLUMN));
        } else {
            sql.append(query.sort().stream()
                    .map(order -> quote(order.field()) + (order.ascending() ? " ASC" : " DESC"))
                    .collect(Collectors.joining(", ")));
        }

        sql.append(" LIMIT ? OFFSET ?");
        params.add(query.limit());
        params.add(query.offset());
        return new SqlStatement(sql.toString(), params);
    }

    static SqlStatement count(String tableName, Map<String, Object> filter) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM ").append(quote(tableName));
        appendWhere(sql, params, filter);
        return new SqlStatement(sql.toString(), params);
    }

    static String insert(String tableName, List<String> columns) {
        String columnList = columns.stream().map(SchemaGeneratorService::quote).collect(Collectors.joining(", "));
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        return "INSERT INTO " + quote(tableName) + " (" + columnList + ") VALUES (" + placeholders + ")";
    }

    private static void appendWhere(StringBuilder sql, List<Object> params, Map<String, Object> filter) {
        if (filter == null || filter.isEmpty()) {
            return;
        }
        List<String> conditions = new ArrayList<>();
        filter.forEach((column, value) -> {
            if (value == null) {
                conditions.add(quote(column) + " IS NULL");
            } else {
                conditions.add(quote(column) + " = ?");
                params.add(value);
            }
        });
        sql.append(" WHERE ").append(String.join(" AND ", conditions));
    }
}
