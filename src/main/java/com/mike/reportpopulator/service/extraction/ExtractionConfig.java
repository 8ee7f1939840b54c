package com.mike.reportpopulator.service.extraction;

import lombok.Builder;

import java.util.List;
import java.util.Objects;

/**
 * Catalogs for one extraction run. A {@code null} catalog means "not configured" and
 * the matching step is skipped.
 */
@Builder
public record ExtractionConfig(
        CompanyCatalog companies,
        KeywordCatalog keywords,
        List<String> labels,
        FieldPatternMap fields
) {
    public ExtractionConfig {
        labels = labels == null ? null : labels.stream().filter(Objects::nonNull).toList();
    }

    public static ExtractionConfig empty() {
        return new ExtractionConfig(null, null, null, null);
    }
}
