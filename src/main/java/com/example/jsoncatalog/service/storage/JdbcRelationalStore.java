package com.example.jsoncatalog.service.storage;

import com.example.jsoncatalog.model.ir.ColumnType;
import com.example.jsoncatalog.model.ir.SchemaField;
import com.example.jsoncatalog.service.schema.SchemaGeneratorService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * PostgreSQL dataset tables, accessed through the application's {@link JdbcTemplate}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JdbcRelationalStore implements RelationalStore {

    private final JdbcTemplate jdbcTemplate;

    @Value("${app.ingest.insert-batch-size:500}")
    private int batchSize = 500;

    @Override
    public void createTable(String ddl) {
        log.debug("Executing DDL: {}", ddl);
        jdbcTemplate.execute(ddl);
    }

    @Override
    public int insertRecords(String tableName, List<SchemaField> columns, List<JsonNode> records) {
        if (records.isEmpty() || columns.isEmpty()) {
            return 0;
        }
        List<String> columnNames = columns.stream().map(SchemaField::getColumnName).toList();
        int[] argTypes = columns.stream()
                .mapToInt(field -> ColumnType.forType(field.getType()).getJdbcType())
                .toArray();
        String sql = SqlRecordQueryBuilder.insert(tableName, columnNames);

        int chunkSize = Math.max(1, batchSize);
        int written = 0;
        for (int start = 0; start < records.size(); start += chunkSize) {
            List<JsonNode> chunk = records.subList(start, Math.min(records.size(), start + chunkSize));
            List<Object[]> batchArgs = new ArrayList<>(chunk.size());
            for (JsonNode record : chunk) {
                Object[] row = new Object[columns.size()];
                for (int i = 0; i < columns.size(); i++) {
                    SchemaField field = columns.get(i);
                    row[i] = toJdbcValue(record.get(field.getName()), ColumnType.forType(field.getType()));
                }
                batchArgs.add(row);
            }
            int[] counts = jdbcTemplate.batchUpdate(sql, batchArgs, argTypes);
            for (int count : counts) {
                written += count >= 0 ? count : 1; // SUCCESS_NO_INFO still means one row
            }
            log.debug("Inserted batch of {} row(s) into {}", chunk.size(), tableName);
        }
        log.info("Stored {} records in table: {}", written, tableName);
        return written;
    }

    @Override
    public void dropTable(String tableName) {
        jdbcTemplate.execute("DROP TABLE IF EXISTS " + SchemaGeneratorService.quote(tableName));
        log.info("Dropped table: {}", tableName);
    }

    @Override
    public List<Map<String, Object>> find(String tableName, RecordQuery query) {
        SqlRecordQueryBuilder.SqlStatement statement = SqlRecordQueryBuilder.select(tableName, query);
        log.debug("Querying {}: {}", tableName, statement.sql());
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(statement.sql(), statement.args());
        log.info("Retrieved {} records from table: {}", rows.size(), tableName);
        return rows;
    }

    @Override
    public long count(String tableName, Map<String, Object> filter) {
        SqlRecordQueryBuilder.SqlStatement statement = SqlRecordQueryBuilder.count(tableName, filter);
        Long total = jdbcTemplate.queryForObject(statement.sql(), Long.class, statement.args());
        return total != null ? total : 0L;
    }

    static Object toJdbcValue(JsonNode value, ColumnType columnType) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        return switch (columnType) {
            case NUMERIC -> value.isNumber() ? value.decimalValue() : value.asText();
            case BOOLEAN -> value.isBoolean() ? value.booleanValue() : value.asText();
            case SERIALIZED_TEXT -> value.toString();
            case TEXT -> value.isContainerNode() ? value.toString() : value.asText();
        };
    }
}
