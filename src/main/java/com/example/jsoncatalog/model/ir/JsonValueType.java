package com.example.jsoncatalog.model.ir;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Primitive type tags observed while scanning JSON values.
 */
public enum JsonValueType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    ARRAY("array"),
    OBJECT("object"),
    NULL("null");

    private final String tag;

    JsonValueType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    public static JsonValueType of(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) return NULL;
        if (value.isObject()) return OBJECT;
        if (value.isArray()) return ARRAY;
        if (value.isNumber()) return NUMBER;
        if (value.isBoolean()) return BOOLEAN;
        return STRING; // text, binary, POJO nodes
    }
}
