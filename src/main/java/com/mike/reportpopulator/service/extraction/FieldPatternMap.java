package com.mike.reportpopulator.service.extraction;

import com.mike.reportpopulator.exception.InvalidExtractionConfigException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Output field name to the patterns that may fill it. Every pattern is compiled
 * case-insensitively and must declare a capturing group; group 1 is the value.
 */
public final class FieldPatternMap {

    private static final FieldPatternMap EMPTY = new FieldPatternMap(Map.of());

    private final Map<String, List<Pattern>> patterns;

    private FieldPatternMap(Map<String, List<Pattern>> patterns) {
        this.patterns = patterns;
    }

    public static FieldPatternMap empty() {
        return EMPTY;
    }

    public static FieldPatternMap compile(Map<String, List<String>> source) {
        if (source == null || source.isEmpty()) return EMPTY;

        Map<String, List<Pattern>> compiled = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : source.entrySet()) {
            String field = entry.getKey();
            if (field == null || field.isBlank()) {
                throw new InvalidExtractionConfigException("Field name must not be blank");
            }
            List<Pattern> fieldPatterns = new ArrayList<>();
            List<String> regexes = entry.getValue() == null ? List.of() : entry.getValue();
            for (String regex : regexes) {
                fieldPatterns.add(compileOne(field, regex));
            }
            compiled.put(field, List.copyOf(fieldPatterns));
        }
        return new FieldPatternMap(Collections.unmodifiableMap(compiled));
    }

    private static Pattern compileOne(String field, String regex) {
        if (regex == null || regex.isBlank()) {
            throw new InvalidExtractionConfigException("Empty pattern for field '" + field + "'");
        }
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new InvalidExtractionConfigException(
                    "Invalid pattern for field '" + field + "': " + regex, e);
        }
        if (pattern.matcher("").groupCount() < 1) {
            throw new InvalidExtractionConfigException(
                    "Pattern for field '" + field + "' has no capturing group: " + regex);
        }
        return pattern;
    }

    public Map<String, List<Pattern>> asMap() {
        return patterns;
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }
}
