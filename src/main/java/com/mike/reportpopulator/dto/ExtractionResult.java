package com.mike.reportpopulator.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Everything extracted from one message. Optional values are {@code null} when
 * nothing matched; collections are never {@code null}.
 */
@Value
@Builder
public class ExtractionResult {

    @Builder.Default
    List<String> matchedKeywords = List.of();

    @Builder.Default
    Map<String, String> extractedData = Map.of();

    /** Always a literal entry of the company catalog. */
    String company;

    /** Upper-cased. */
    String reference;

    LocalDateTime datetime;

    @Builder.Default
    Map<String, List<String>> keywordsByCategory = Map.of();

    @Builder.Default
    Map<String, String> fields = Map.of();

    public boolean isEmpty() {
        return matchedKeywords.isEmpty()
                && company == null
                && reference == null
                && datetime == null
                && keywordsByCategory.isEmpty()
                && fields.isEmpty();
    }

    public String toLogLine() {
        return "company=" + company +
                " reference=" + reference +
                " datetime=" + datetime +
                " categories=" + keywordsByCategory.keySet() +
                " matchedKeywords=" + matchedKeywords.size() +
                " fields=" + fields.keySet();
    }
}
