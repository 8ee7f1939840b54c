package com.mike.reportpopulator.service.extraction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
@Slf4j
public class IncidentReferenceExtractor {

    private static final String THREE_SEGMENTS = "(\\w+-\\d+-\\d+)";
    private static final String TWO_SEGMENTS = "(\\w+-\\d+)";

    private static final List<String> LABELS = List.of("incident", "reference", "ref", "case", "ticket");

    /**
     * Labelled codes first (INC-2025-001 before INC-001 per label), then bare codes.
     */
    private static final List<Pattern> CASCADE = buildCascade();

    private static List<Pattern> buildCascade() {
        List<Pattern> cascade = new ArrayList<>();
        for (String label : LABELS) {
            cascade.add(Pattern.compile(label + "[:\\s#]+" + THREE_SEGMENTS, Pattern.CASE_INSENSITIVE));
            cascade.add(Pattern.compile(label + "[:\\s#]+" + TWO_SEGMENTS, Pattern.CASE_INSENSITIVE));
        }
        cascade.add(Pattern.compile(THREE_SEGMENTS));
        cascade.add(Pattern.compile(TWO_SEGMENTS));
        return List.copyOf(cascade);
    }

    public Optional<String> extract(String text) {
        if (text == null || text.isEmpty()) return Optional.empty();

        for (Pattern pattern : CASCADE) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                String reference = matcher.group(1).toUpperCase(Locale.ROOT);
                log.debug("IncidentReferenceExtractor: found reference={}", reference);
                return Optional.of(reference);
            }
        }
        log.debug("IncidentReferenceExtractor: no reference found");
        return Optional.empty();
    }
}
