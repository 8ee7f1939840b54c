package com.mike.reportpopulator.service.extraction;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form used for keyword and company matching. Regex extractors work on the
 * raw text instead, so captured values keep their original casing.
 */
@Component
public class TextNormalizer {

    private static final Pattern SEPARATORS = Pattern.compile("[_\\-:;,.\\n\\r\\t]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    public String normalize(String input) {
        if (input == null || input.isEmpty()) return "";
        String s = input.toLowerCase(Locale.ROOT);
        s = SEPARATORS.matcher(s).replaceAll(" ");
        s = WHITESPACE_RUN.matcher(s).replaceAll(" ");
        return s;
    }
}
