package com.example.jsoncatalog.service.ingest;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record DatasetProfile(String format,
                             List<ProfileField> fields,
                             List<JsonNode> sampleRecords,
                             int recordCount,
                             int skippedLines) {
}
