package com.example.jsoncatalog.service.analysis;

import com.example.jsoncatalog.model.ir.FieldInfo;
import com.example.jsoncatalog.model.ir.JsonValueType;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the per-field type map of a record set. Type sets are unions across all records;
 * conflicting types are kept, never resolved here.
 */
@Component
public class JsonFieldAnalyzer {

    public Map<String, FieldInfo> analyze(List<JsonNode> records) {
        Map<String, FieldInfo> fields = new LinkedHashMap<>();
        Map<String, Integer> occurrences = new HashMap<>();
        int objectRecords = 0;

        for (JsonNode record : records) {
            if (record == null || !record.isObject()) {
                continue;
            }
            objectRecords++;
            for (Iterator<Map.Entry<String, JsonNode>> it = record.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = it.next();
                mergeValue(fields.computeIfAbsent(entry.getKey(), k -> new FieldInfo()), entry.getValue());
                occurrences.merge(entry.getKey(), 1, Integer::sum);
            }
        }

        // A key missing from at least one record is nullable
        for (Map.Entry<String, FieldInfo> entry : fields.entrySet()) {
            if (occurrences.getOrDefault(entry.getKey(), 0) < objectRecords) {
                entry.getValue().setNullable(true);
            }
        }
        return fields;
    }

    private void mergeValue(FieldInfo info, JsonNode value) {
        JsonValueType type = JsonValueType.of(value);
        info.getTypes().add(type);

        switch (type) {
            case NULL -> info.setNullable(true);
            case OBJECT -> {
                info.setNested(true);
                info.setDepth(Math.max(info.getDepth(), depthOf(value)));
                for (Iterator<Map.Entry<String, JsonNode>> it = value.fields(); it.hasNext(); ) {
                    Map.Entry<String, JsonNode> child = it.next();
                    mergeValue(info.getNestedFields().computeIfAbsent(child.getKey(), k -> new FieldInfo()), child.getValue());
                }
            }
            case ARRAY -> {
                info.setDepth(Math.max(info.getDepth(), depthOf(value)));
                // a flat array of scalars stays tabular
                for (JsonNode element : value) {
                    if (element.isContainerNode()) {
                        info.setNested(true);
                        break;
                    }
                }
            }
            default -> {
                // scalar: type tag is enough
            }
        }
    }

    static int depthOf(JsonNode value) {
        if (value == null || !value.isContainerNode()) {
            return 0;
        }
        int deepest = 0;
        for (JsonNode child : value) {
            deepest = Math.max(deepest, depthOf(child));
        }
        return deepest + 1;
    }
}
