package com.example.jsoncatalog.service.schema;

import com.example.jsoncatalog.model.ir.ColumnType;
import com.example.jsoncatalog.model.ir.FieldInfo;
import com.example.jsoncatalog.model.ir.JsonValueType;
import com.example.jsoncatalog.model.ir.SchemaDescriptor;
import com.example.jsoncatalog.model.ir.SchemaField;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives the relational table name and DDL, the structural JSON schema and the flat field list
 * from a field analysis.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SchemaGeneratorService {

    public static final String ROW_ID_COLUMN = "_row_id";
    public static final String INGESTED_AT_COLUMN = "_ingested_at";

    // Most specific first; a field whose only observation is null falls back to string
    private static final List<JsonValueType> TYPE_PRIORITY = List.of(
            JsonValueType.NUMBER, JsonValueType.BOOLEAN, JsonValueType.STRING, JsonValueType.ARRAY, JsonValueType.OBJECT);

    // PostgreSQL truncates identifiers at 63 bytes
    private static final int MAX_TABLE_BASE_LENGTH = 40;

    private final ObjectMapper objectMapper;

    public SchemaDescriptor generate(String datasetName, String datasetId, Map<String, FieldInfo> fields) {
        String tableName = generateTableName(datasetName, datasetId);
        List<SchemaField> schemaFields = toSchemaFields(fields);
        return new SchemaDescriptor(tableName, generatePostgresDDL(tableName, schemaFields),
                generateJsonSchema(fields), schemaFields);
    }

    public String generateTableName(String datasetName, String datasetId) {
        String base = sanitizeIdentifier(stripExtension(datasetName));
        if (base.length() > MAX_TABLE_BASE_LENGTH) {
            base = base.substring(0, MAX_TABLE_BASE_LENGTH);
        }
        String token = datasetId.replace("-", "");
        token = token.substring(0, Math.min(8, token.length())).toLowerCase(Locale.ROOT);
        return "dataset_" + base + "_" + token;
    }

    /**
     * Fields in discovery order, each resolved to exactly one dominant type.
     */
    public List<SchemaField> toSchemaFields(Map<String, FieldInfo> fields) {
        List<SchemaField> result = new ArrayList<>(fields.size());
        fields.forEach((name, info) -> result.add(new SchemaField(
                name,
                sanitizeIdentifier(name),
                dominantType(info),
                info.isNullable(),
                info.isNested(),
                info.isArray(),
                null)));
        return result;
    }

    public String generatePostgresDDL(String tableName, List<SchemaField> fields) {
        List<String> columns = new ArrayList<>();
        columns.add(quote(ROW_ID_COLUMN) + " BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY");
        columns.add(quote(INGESTED_AT_COLUMN) + " TIMESTAMP DEFAULT CURRENT_TIMESTAMP");
        for (SchemaField field : fields) {
            // nullable by default: records are heterogeneous
            columns.add(quote(field.getColumnName()) + " " + ColumnType.forType(field.getType()).getSqlName());
        }
        String ddl = "CREATE TABLE IF NOT EXISTS " + quote(tableName) + " (\n  " + String.join(",\n  ", columns) + "\n)";
        log.debug("Generated PostgreSQL DDL for table {}: {} column(s)", tableName, columns.size());
        return ddl;
    }

    public ObjectNode generateJsonSchema(Map<String, FieldInfo> fields) {
        ObjectNode schema = objectMapper.createObjectNode();
        schema.put("$schema", "http://json-schema.org/draft-07/schema#");
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        ArrayNode required = objectMapper.createArrayNode();

        fields.forEach((name, info) -> {
            properties.set(name, toJsonSchemaProperty(info));
            if (!info.isNullable()) {
                required.add(name);
            }
        });
        if (!required.isEmpty()) {
            schema.set("required", required);
        }
        return schema;
    }

    private ObjectNode toJsonSchemaProperty(FieldInfo info) {
        ObjectNode property = objectMapper.createObjectNode();
        List<String> tags = info.getTypes().stream().map(JsonValueType::getTag).toList();
        if (tags.size() == 1) {
            property.put("type", tags.get(0));
        } else if (tags.isEmpty()) {
            property.put("type", JsonValueType.STRING.getTag());
        } else {
            ArrayNode typeList = property.putArray("type");
            tags.forEach(typeList::add);
        }
        property.put("nullable", info.isNullable());
        property.put("nested", info.isNested());
        property.put("array", info.isArray());

        if (info.getTypes().contains(JsonValueType.OBJECT) && !info.getNestedFields().isEmpty()) {
            ObjectNode nestedProperties = property.putObject("properties");
            info.getNestedFields().forEach((name, child) -> nestedProperties.set(name, toJsonSchemaProperty(child)));
        } else if (info.isArray() && info.isNested()) {
            property.putObject("items").put("type", "object");
        }
        return property;
    }

    /**
     * Deterministic and total: number > boolean > string > array > object.
     */
    public static JsonValueType dominantType(FieldInfo info) {
        for (JsonValueType candidate : TYPE_PRIORITY) {
            if (info.getTypes().contains(candidate)) {
                return candidate;
            }
        }
        return JsonValueType.STRING;
    }

    public static String sanitizeIdentifier(String identifier) {
        String cleaned = identifier == null ? "" : identifier.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
        if (cleaned.isEmpty()) {
            return "col";
        }
        return Character.isDigit(cleaned.charAt(0)) ? "_" + cleaned : cleaned;
    }

    public static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    private static String stripExtension(String name) {
        return name == null ? "" : name.replaceFirst("\\.[^/.]+$", "");
    }
}
