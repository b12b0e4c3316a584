package com.example.jsoncatalog.model.ir;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Result of a Field Analyzer pass: the per-field map plus the reconstructed records.
 *
 * @param format       "json" or "ndjson"
 * @param fields       field name to analysis, in discovery order
 * @param records      one entry per logical record
 * @param skippedLines malformed NDJSON lines that were dropped
 */
public record JsonAnalysis(String format, Map<String, FieldInfo> fields, List<JsonNode> records, int skippedLines) {

    public int recordCount() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * True when every record is a JSON object and there is at least one of them.
     */
    public boolean isArrayOfObjects() {
        return !records.isEmpty() && records.stream().allMatch(JsonNode::isObject);
    }
}
