package com.mike.reportpopulator.service.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldPatternFile(Map<String, List<String>> fields) {

    public FieldPatternFile {
        fields = fields == null ? Map.of() : fields;
    }

    static FieldPatternFile defaults() {
        return new FieldPatternFile(Map.of());
    }
}
