package com.example.jsoncatalog.service.retrieval;

import com.example.jsoncatalog.model.ir.FieldInfo;
import com.example.jsoncatalog.model.ir.JsonValueType;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Field types of a document dataset as observed at ingest, used to type query-string filter values.
 * Dotted names address nested fields.
 */
final class DocumentFields {

    private final Map<String, FieldInfo> fields;

    DocumentFields(Map<String, FieldInfo> fields) {
        this.fields = fields != null ? fields : Map.of();
    }

    Map<String, Object> coerceFilter(Map<String, Object> filter) {
        if (filter == null) {
            return null;
        }
        Map<String, Object> typed = new LinkedHashMap<>();
        filter.forEach((name, value) -> typed.put(name, coerce(name, value)));
        return typed;
    }

    /**
     * Types a string value for a number or boolean field. Fields that were ever seen holding a
     * string keep the value as given.
     */
    Object coerce(String name, Object value) {
        FieldInfo info = lookup(name);
        if (!(value instanceof String text) || info == null) {
            return value;
        }
        Set<JsonValueType> types = info.getTypes();
        if (types.contains(JsonValueType.STRING)) {
            return value;
        }
        String trimmed = text.trim();
        if (types.contains(JsonValueType.NUMBER)) {
            BigDecimal number = parseNumber(trimmed);
            if (number != null) {
                return RelationalColumns.normalize(number);
            }
        }
        if (types.contains(JsonValueType.BOOLEAN) && ("true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed))) {
            return Boolean.parseBoolean(trimmed);
        }
        return value;
    }

    private static BigDecimal parseNumber(String text) {
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private FieldInfo lookup(String name) {
        FieldInfo info = fields.get(name);
        if (info != null || name.indexOf('.') < 0) {
            return info;
        }
        Map<String, FieldInfo> level = fields;
        for (String part : name.split("\\.")) {
            if (level == null) {
                return null;
            }
            info = level.get(part);
            if (info == null) {
                return null;
            }
            level = info.getNestedFields();
        }
        return info;
    }
}
