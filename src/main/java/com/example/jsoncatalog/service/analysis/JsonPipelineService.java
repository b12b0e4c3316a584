package com.example.jsoncatalog.service.analysis;

import com.example.jsoncatalog.exception.JsonAnalysisException;
import com.example.jsoncatalog.model.ir.FieldInfo;
import com.example.jsoncatalog.model.ir.JsonAnalysis;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a JSON or NDJSON file into records and runs the field analysis over them.
 */
@Service
@Slf4j
public class JsonPipelineService {

    public static final String FORMAT_JSON = "json";
    public static final String FORMAT_NDJSON = "ndjson";

    private final ObjectMapper objectMapper;
    private final JsonFieldAnalyzer fieldAnalyzer;

    public JsonPipelineService(ObjectMapper objectMapper, JsonFieldAnalyzer fieldAnalyzer) {
        this.objectMapper = objectMapper.copy();
        this.objectMapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.fieldAnalyzer = fieldAnalyzer;
    }

    /**
     * ".ndjson" and ".jsonl" files are line-delimited, everything else is a single document.
     */
    public static String detectFormat(String fileName) {
        String lower = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        return lower.endsWith(".ndjson") || lower.endsWith(".jsonl") ? FORMAT_NDJSON : FORMAT_JSON;
    }

    public JsonAnalysis analyzeFile(Path filePath) throws IOException {
        return analyzeFile(filePath, filePath.getFileName().toString());
    }

    /**
     * Staged uploads may lose their extension, so the format is taken from the name the client sent.
     */
    public JsonAnalysis analyzeFile(Path filePath, String originalName) throws IOException {
        String format = detectFormat(originalName);
        return FORMAT_NDJSON.equals(format) ? analyzeNdjson(filePath) : analyzeJson(filePath);
    }

    private JsonAnalysis analyzeJson(Path filePath) throws IOException {
        String content = Files.readString(filePath, StandardCharsets.UTF_8);
        if (content.isBlank()) {
            log.warn("JSON file is empty: {}", filePath);
            return new JsonAnalysis(FORMAT_JSON, Map.of(), List.of(), 0);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw toAnalysisException(filePath, e);
        }

        List<JsonNode> records = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(records::add);
        } else {
            records.add(root);
        }

        Map<String, FieldInfo> fields = fieldAnalyzer.analyze(records);
        log.info("JSON file processed: {}, records: {}, fields: {}", filePath, records.size(), fields.size());
        return new JsonAnalysis(FORMAT_JSON, fields, records, 0);
    }

    private JsonAnalysis analyzeNdjson(Path filePath) throws IOException {
        List<JsonNode> records = new ArrayList<>();
        int skipped = 0;
        int lineNumber = 0;

        try (BufferedReader reader = Files.newBufferedReader(filePath, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    records.add(objectMapper.readTree(line));
                } catch (JsonProcessingException e) {
                    skipped++;
                    log.debug("Skipping malformed NDJSON line {} in {}: {}", lineNumber, filePath, e.getOriginalMessage());
                }
            }
        }

        if (skipped > 0) {
            log.warn("NDJSON file {}: skipped {} malformed line(s)", filePath, skipped);
        }
        Map<String, FieldInfo> fields = fieldAnalyzer.analyze(records);
        log.info("NDJSON file processed: {}, records: {}, fields: {}", filePath, records.size(), fields.size());
        return new JsonAnalysis(FORMAT_NDJSON, fields, records, skipped);
    }

    private JsonAnalysisException toAnalysisException(Path filePath, JsonProcessingException e) {
        JsonLocation location = e.getLocation();
        int line = location != null ? location.getLineNr() : -1;
        int column = location != null ? location.getColumnNr() : -1;
        return new JsonAnalysisException(filePath.toString(), line, column, e.getOriginalMessage(), e);
    }
}
