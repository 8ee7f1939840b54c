package com.mike.reportpopulator.service.extraction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

@Component
@RequiredArgsConstructor
@Slf4j
public class KeywordCategorizer {

    private final TextNormalizer normalizer;

    /**
     * Whole-word matches per category. Categories without a hit are left out.
     */
    public Map<String, List<String>> categorize(String text, KeywordCatalog catalog) {
        if (catalog == null || catalog.isEmpty()) return Map.of();

        String normalizedText = normalizer.normalize(text);
        Map<String, List<String>> result = new LinkedHashMap<>();

        catalog.categories().forEach((category, keywords) -> {
            List<String> hits = new ArrayList<>();
            for (String keyword : keywords) {
                if (containsWord(normalizedText, keyword)) hits.add(keyword);
            }
            if (!hits.isEmpty()) result.put(category, List.copyOf(hits));
        });

        log.debug("KeywordCategorizer: matched keywords in {} categories", result.size());
        return Collections.unmodifiableMap(result);
    }

    private boolean containsWord(String normalizedText, String keyword) {
        String normalizedKeyword = normalizer.normalize(keyword).trim();
        if (normalizedKeyword.isEmpty()) return false;
        return Pattern.compile("\\b" + Pattern.quote(normalizedKeyword) + "\\b")
                .matcher(normalizedText)
                .find();
    }
}
