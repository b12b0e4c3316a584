package com.example.jsoncatalog.model.ir;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Data
@JsonInclude(JsonInclude.Include.NON_EMPTY) // nestedFields only for object-valued fields
public class FieldInfo {
    private Set<JsonValueType> types = EnumSet.noneOf(JsonValueType.class);
    private boolean nullable;
    private boolean nested;
    private int depth; // max nesting depth of the observed values, 0 for scalars
    private Map<String, FieldInfo> nestedFields = new LinkedHashMap<>();

    @JsonIgnore
    public boolean isArray() {
        return types.contains(JsonValueType.ARRAY);
    }

    @JsonIgnore
    public boolean isObserved() {
        return !types.isEmpty();
    }
}
