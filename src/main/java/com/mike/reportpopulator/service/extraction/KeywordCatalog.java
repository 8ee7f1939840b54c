package com.mike.reportpopulator.service.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Category name to keywords, in the order they were configured.
 */
public record KeywordCatalog(Map<String, List<String>> categories) {

    public KeywordCatalog {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (categories != null) {
            categories.forEach((category, keywords) -> {
                if (category == null) return;
                copy.put(category, keywords == null ? List.of() : keywords.stream()
                        .filter(k -> k != null && !k.isBlank())
                        .toList());
            });
        }
        categories = Collections.unmodifiableMap(copy);
    }

    public boolean isEmpty() {
        return categories.isEmpty();
    }
}
