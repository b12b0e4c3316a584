package com.example.jsoncatalog.service.retrieval;

import com.example.jsoncatalog.exception.InvalidRequestException;
import com.example.jsoncatalog.service.storage.SortOrder;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns {@code orderBy} / {@code sort} request members into sort orders over request field names.
 */
final class SortSpecParser {

    private SortSpecParser() {
    }

    static List<SortOrder> parse(String operation, String datasetId, String orderBy, Map<String, Object> sort) {
        if (sort != null && !sort.isEmpty()) {
            List<SortOrder> orders = new ArrayList<>(sort.size());
            sort.forEach((field, direction) -> orders.add(new SortOrder(field, isAscending(operation, datasetId, field, direction))));
            return orders;
        }
        if (StringUtils.hasText(orderBy)) {
            return List.of(SortOrder.asc(orderBy.trim()));
        }
        return List.of();
    }

    private static boolean isAscending(String operation, String datasetId, String field, Object direction) {
        if (direction instanceof Number number) {
            if (number.intValue() == 1) return true;
            if (number.intValue() == -1) return false;
        } else if (direction instanceof String text) {
            String value = text.trim();
            if ("asc".equalsIgnoreCase(value) || "1".equals(value)) return true;
            if ("desc".equalsIgnoreCase(value) || "-1".equals(value)) return false;
        }
        throw new InvalidRequestException(operation, datasetId,
                "Invalid sort direction for field '" + field + "': " + direction + " (expected 1, -1, asc or desc)");
    }
}
