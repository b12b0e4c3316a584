package com.example.jsoncatalog.controller;

import com.example.jsoncatalog.exception.InvalidRequestException;
import com.example.jsoncatalog.service.ingest.DatasetProfile;
import com.example.jsoncatalog.service.ingest.IngestResult;
import com.example.jsoncatalog.service.ingest.JsonIngestOrchestrator;
import com.example.jsoncatalog.service.ingest.StagedFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ingests files the upload handler has already placed in the staging directory.
 */
@RestController
@RequestMapping("/api/ingest")
@RequiredArgsConstructor
@Slf4j
public class IngestController {

    private final JsonIngestOrchestrator orchestrator;

    @Value("${app.ingest.staging-dir:./uploads/staging}")
    private String stagingDir;

    public record IngestRequest(String filePath, String originalName, String datasetName) {
    }

    @PostMapping("/json")
    public ResponseEntity<Map<String, Object>> ingestJson(@RequestBody IngestRequest request) throws IOException {
        StagedFile stagedFile = resolveStagedFile(request, "ingest.request");
        log.info("Ingest requested for staged file: {}", stagedFile.filePath());
        IngestResult result = orchestrator.processStagingFile(stagedFile, request.datasetName());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("dataset", result.summary());
        body.put("profile", result.profile());
        body.put("recordCount", result.recordCount());
        body.put("fallback", result.fallback());
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PostMapping("/json/profile")
    public ResponseEntity<Map<String, Object>> profileJson(@RequestBody IngestRequest request) throws IOException {
        StagedFile stagedFile = resolveStagedFile(request, "profile.request");
        DatasetProfile profile = orchestrator.getProfile(stagedFile.filePath(), stagedFile.originalFilename());
        return ResponseEntity.ok(Map.of("success", true, "profile", profile));
    }

    private StagedFile resolveStagedFile(IngestRequest request, String operation) throws IOException {
        if (request == null || !StringUtils.hasText(request.filePath())) {
            throw new InvalidRequestException(operation, null, "'filePath' is required");
        }
        Path stagingRoot = Paths.get(stagingDir).toAbsolutePath().normalize();
        Path file = stagingRoot.resolve(request.filePath()).normalize();
        if (!file.startsWith(stagingRoot)) {
            log.warn("Rejected file outside staging directory: {}", request.filePath());
            throw new InvalidRequestException(operation, null, "File must be inside the staging directory");
        }
        if (!Files.isRegularFile(file)) {
            throw new InvalidRequestException(operation, null, "Staged file not found: " + request.filePath());
        }
        String originalName = StringUtils.hasText(request.originalName()) ? request.originalName() : file.getFileName().toString();
        return new StagedFile(file, originalName, Files.size(file));
    }
}
