package com.mike.reportpopulator.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record LabelledContent(
        List<String> matchedKeywords,
        Map<String, String> extractedData
) {
    public LabelledContent {
        matchedKeywords = List.copyOf(matchedKeywords);
        extractedData = Collections.unmodifiableMap(new LinkedHashMap<>(extractedData));
    }

    public static LabelledContent empty() {
        return new LabelledContent(List.of(), Map.of());
    }
}
