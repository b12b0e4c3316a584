package com.example.jsoncatalog.service.retrieval;

import com.example.jsoncatalog.exception.InvalidRequestException;
import com.example.jsoncatalog.model.ir.ColumnType;
import com.example.jsoncatalog.model.ir.SchemaDescriptor;
import com.example.jsoncatalog.model.ir.SchemaField;
import com.example.jsoncatalog.service.schema.SchemaGeneratorService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps between record field names and the sanitized columns of one dataset table, in both directions.
 */
@Slf4j
final class RelationalColumns {

    private final Map<String, SchemaField> byFieldName = new HashMap<>();
    private final Map<String, SchemaField> byColumnName = new HashMap<>();
    private final ObjectMapper objectMapper;

    RelationalColumns(SchemaDescriptor schema, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        if (schema != null && schema.getFields() != null) {
            for (SchemaField field : schema.getFields()) {
                byFieldName.put(field.getName(), field);
                byColumnName.put(field.getColumnName(), field);
            }
        }
    }

    /**
     * Resolves a request field name, or a column name, to its column.
     */
    SchemaField resolve(String operation, String datasetId, String name) {
        SchemaField field = byFieldName.get(name);
        if (field == null) {
            field = byColumnName.get(name);
        }
        if (field == null) {
            throw new InvalidRequestException(operation, datasetId, "Unknown field: " + name);
        }
        return field;
    }

    /**
     * Converts a filter value to what the column holds. Query-string filters arrive as strings.
     */
    Object coerce(SchemaField field, Object value) {
        if (value == null) {
            return null;
        }
        ColumnType columnType = ColumnType.forType(field.getType());
        if (value instanceof String text) {
            String trimmed = text.trim();
            if (columnType == ColumnType.NUMERIC) {
                try {
                    return new BigDecimal(trimmed);
                } catch (NumberFormatException e) {
                    return text;
                }
            }
            if (columnType == ColumnType.BOOLEAN && ("true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed))) {
                return Boolean.parseBoolean(trimmed);
            }
            return text;
        }
        if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
            return serialize(value);
        }
        if (columnType == ColumnType.NUMERIC && value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (columnType == ColumnType.TEXT || columnType == ColumnType.SERIALIZED_TEXT) {
            return value.toString();
        }
        return value;
    }

    /**
     * Turns a table row back into a record: internal columns dropped, original field names restored,
     * serialized containers parsed and numerics normalized.
     */
    Map<String, Object> toRecord(Map<String, Object> row) {
        Map<String, Object> record = new LinkedHashMap<>();
        row.forEach((column, value) -> {
            if (SchemaGeneratorService.ROW_ID_COLUMN.equals(column) || SchemaGeneratorService.INGESTED_AT_COLUMN.equals(column)) {
                return;
            }
            SchemaField field = byColumnName.get(column);
            if (field == null) {
                record.put(column, normalize(value));
                return;
            }
            if (value instanceof String text && ColumnType.forType(field.getType()) == ColumnType.SERIALIZED_TEXT) {
                record.put(field.getName(), parse(text));
            } else {
                record.put(field.getName(), normalize(value));
            }
        });
        return record;
    }

    static Object normalize(Object value) {
        if (value instanceof BigDecimal decimal) {
            BigDecimal stripped = decimal.stripTrailingZeros();
            if (stripped.scale() <= 0) {
                try {
                    return stripped.longValueExact();
                } catch (ArithmeticException e) {
                    return stripped.toBigInteger();
                }
            }
            return decimal.doubleValue();
        }
        return value;
    }

    private Object parse(String text) {
        try {
            return objectMapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            log.debug("Column value is not serialized JSON, returning raw text: {}", e.getOriginalMessage());
            return text;
        }
    }

    private String serialize(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Filter value cannot be serialized: " + value, e);
        }
    }
}
