package com.example.jsoncatalog.service.backend;

import com.example.jsoncatalog.model.ir.FieldInfo;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Whole-dataset routing policy: any nested field sends the dataset to the document store,
 * since the relational DDL would collapse it into an opaque text column.
 */
@Component
public class BackendSelector {

    public BackendKind determineBackend(Map<String, FieldInfo> fields) {
        boolean hasNested = fields.values().stream().anyMatch(FieldInfo::isNested);
        return hasNested ? BackendKind.NOSQL : BackendKind.SQL;
    }
}
