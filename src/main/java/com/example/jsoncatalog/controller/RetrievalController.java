package com.example.jsoncatalog.controller;

import com.example.jsoncatalog.service.retrieval.RetrievalRequest;
import com.example.jsoncatalog.service.retrieval.RetrievalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/retrieve")
@RequiredArgsConstructor
@Slf4j
public class RetrievalController {

    private static final Set<String> RESERVED_PARAMS = Set.of("dataset", "entity", "fields", "include", "limit", "offset", "orderBy");

    private final RetrievalService retrievalService;

    @PostMapping
    public ResponseEntity<Map<String, Object>> retrieve(@RequestBody RetrievalRequest request) {
        return ResponseEntity.ok(body(retrievalService.retrieve(request)));
    }

    /**
     * Query-string form: every parameter that is not part of the request shape is an equality filter.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> retrieveByQuery(@RequestParam(required = false) String dataset,
                                                               @RequestParam(required = false) String entity,
                                                               @RequestParam(required = false) String fields,
                                                               @RequestParam(required = false) String include,
                                                               @RequestParam(required = false) Integer limit,
                                                               @RequestParam(required = false) Integer offset,
                                                               @RequestParam(required = false) String orderBy,
                                                               @RequestParam Map<String, String> params) {
        Map<String, Object> filter = new LinkedHashMap<>();
        params.forEach((key, value) -> {
            if (!RESERVED_PARAMS.contains(key)) {
                filter.put(key, value);
            }
        });
        RetrievalRequest request = new RetrievalRequest(dataset, entity, filter, splitList(fields), splitList(include),
                limit, offset, orderBy, null);
        return ResponseEntity.ok(body(retrievalService.retrieve(request)));
    }

    private static Map<String, Object> body(List<Map<String, Object>> records) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("data", records);
        body.put("count", records.size());
        return body;
    }

    private static List<String> splitList(String csv) {
        if (!StringUtils.hasText(csv)) {
            return null;
        }
        return Arrays.stream(csv.split(",")).map(String::trim).filter(StringUtils::hasText).toList();
    }
}
