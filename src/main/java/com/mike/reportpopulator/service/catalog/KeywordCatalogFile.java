package com.mike.reportpopulator.service.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KeywordCatalogFile(Map<String, List<String>> categories) {

    public KeywordCatalogFile {
        categories = categories == null ? Map.of() : categories;
    }

    static KeywordCatalogFile defaults() {
        Map<String, List<String>> categories = new LinkedHashMap<>();
        categories.put("Incident Type", List.of("outage", "breach", "failure", "error"));
        categories.put("Priority", List.of("high", "medium", "low", "critical", "urgent"));
        categories.put("Status", List.of("resolved", "ongoing", "investigating", "mitigated"));
        return new KeywordCatalogFile(categories);
    }
}
