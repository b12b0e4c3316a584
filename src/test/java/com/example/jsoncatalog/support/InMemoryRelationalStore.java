package com.example.jsoncatalog.support;

import com.example.jsoncatalog.model.ir.ColumnType;
import com.example.jsoncatalog.model.ir.SchemaField;
import com.example.jsoncatalog.service.schema.SchemaGeneratorService;
import com.example.jsoncatalog.service.storage.RecordQuery;
import com.example.jsoncatalog.service.storage.RelationalStore;
import com.example.jsoncatalog.service.storage.SortOrder;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.BadSqlGrammarException;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tables as lists of rows. Rows hold JDBC-like values: BigDecimal for numerics, JSON text for containers.
 */
public class InMemoryRelationalStore implements RelationalStore {

    private static final Pattern TABLE_NAME = Pattern.compile("CREATE TABLE IF NOT EXISTS \"([^\"]+)\"");

    private final Map<String, List<Map<String, Object>>> tables = new LinkedHashMap<>();
    private final Set<String> droppedTables = new HashSet<>();
    private boolean failInserts;

    public void failInserts() {
        this.failInserts = true;
    }

    public boolean hasTable(String tableName) {
        return tables.containsKey(tableName);
    }

    public Set<String> getDroppedTables() {
        return droppedTables;
    }

    public List<Map<String, Object>> rows(String tableName) {
        return tables.getOrDefault(tableName, List.of());
    }

    @Override
    public void createTable(String ddl) {
        Matcher matcher = TABLE_NAME.matcher(ddl);
        if (!matcher.find()) {
            throw new IllegalArgumentException("Not a CREATE TABLE statement: " + ddl);
        }
        tables.putIfAbsent(matcher.group(1), new ArrayList<>());
    }

    @Override
    public int insertRecords(String tableName, List<SchemaField> columns, List<JsonNode> records) {
        if (failInserts) {
            throw new DataIntegrityViolationException("simulated insert failure into " + tableName);
        }
        if (records.isEmpty() || columns.isEmpty()) {
            // same as the JDBC store, which has no column list to insert
            return 0;
        }
        List<Map<String, Object>> rows = tables.get(tableName);
        long rowId = rows.size();
        for (JsonNode record : records) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(SchemaGeneratorService.ROW_ID_COLUMN, ++rowId);
            row.put(SchemaGeneratorService.INGESTED_AT_COLUMN, new Timestamp(0));
            for (SchemaField column : columns) {
                row.put(column.getColumnName(), toValue(record.get(column.getName()), ColumnType.forType(column.getType())));
            }
            rows.add(row);
        }
        return records.size();
    }

    @Override
    public void dropTable(String tableName) {
        tables.remove(tableName);
        droppedTables.add(tableName);
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> find(String tableName, RecordQuery query) {
        List<Map<String, Object>> matched = new ArrayList<>(filter(tableName, query.filter()));
        if (!query.sort().isEmpty()) {
            Comparator<Map<String, Object>> comparator = null;
            for (SortOrder order : query.sort()) {
                Comparator<Map<String, Object>> next = Comparator.comparing(
                        row -> (Comparable<Object>) row.get(order.field()), Comparator.nullsLast(Comparator.naturalOrder()));
                if (!order.ascending()) {
                    next = next.reversed();
                }
                comparator = comparator == null ? next : comparator.thenComparing(next);
            }
            matched.sort(comparator);
        }
        return matched.stream()
                .skip(query.offset())
                .limit(query.limit())
                .map(row -> project(row, query.fields()))
                .toList();
    }

    @Override
    public long count(String tableName, Map<String, Object> filter) {
        return filter(tableName, filter).size();
    }

    private List<Map<String, Object>> filter(String tableName, Map<String, Object> filter) {
        List<Map<String, Object>> rows = tables.get(tableName);
        if (rows == null) {
            throw new BadSqlGrammarException("select", "SELECT", new SQLException("relation does not exist"));
        }
        return rows.stream()
                .filter(row -> filter.entrySet().stream().allMatch(e -> matches(row.get(e.getKey()), e.getValue())))
                .toList();
    }

    private static boolean matches(Object actual, Object expected) {
        if (actual instanceof BigDecimal a && expected instanceof BigDecimal b) {
            return a.compareTo(b) == 0;
        }
        return Objects.equals(actual, expected);
    }

    private static Map<String, Object> project(Map<String, Object> row, List<String> fields) {
        if (fields.isEmpty()) {
            return new LinkedHashMap<>(row);
        }
        Map<String, Object> projected = new LinkedHashMap<>();
        fields.forEach(field -> projected.put(field, row.get(field)));
        return projected;
    }

    private static Object toValue(JsonNode value, ColumnType columnType) {
        if (value == null || value.isNull()) {
            return null;
        }
        return switch (columnType) {
            case NUMERIC -> value.decimalValue();
            case BOOLEAN -> value.booleanValue();
            case SERIALIZED_TEXT -> value.toString();
            case TEXT -> value.isContainerNode() ? value.toString() : value.asText();
        };
    }
}
