package com.mike.reportpopulator.service.extraction;

import com.mike.reportpopulator.dto.LabelledContent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the value written next to a label such as {@code Status: Ongoing}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KeywordValueExtractor {

    private static final String VALUE = "([^:\\n\\r]+?)";
    private static final String LINE_END = "(?:\\n|\\r|$)";

    // Tried in order, first match wins.
    private static final List<Function<String, String>> CASCADE = List.of(
            kw -> kw + "[:\\s]+" + VALUE + LINE_END,
            kw -> kw + "\\s*=\\s*" + VALUE + LINE_END,
            kw -> kw + "\\s*-\\s*" + VALUE + LINE_END,
            kw -> kw + "\\s+is\\s+" + VALUE + LINE_END,
            kw -> VALUE + "\\s+for\\s+" + kw + LINE_END
    );

    private final TextNormalizer normalizer;

    public Optional<String> extractValue(String text, String keyword) {
        if (text == null || text.isEmpty() || keyword == null || keyword.isBlank()) {
            return Optional.empty();
        }
        String quoted = Pattern.quote(keyword);
        for (int step = 0; step < CASCADE.size(); step++) {
            Pattern pattern = Pattern.compile(CASCADE.get(step).apply(quoted), Pattern.CASE_INSENSITIVE);
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                String value = matcher.group(1).trim();
                log.debug("KeywordValueExtractor: keyword='{}' matched at step={} value='{}'", keyword, step + 1, value);
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * Substring match of each normalized label against the normalized text, followed by a
     * value lookup for every label found.
     */
    public LabelledContent parseContent(String text, List<String> keywords) {
        if (keywords == null || keywords.isEmpty()) return LabelledContent.empty();

        String normalizedText = normalizer.normalize(text);
        List<String> matched = new ArrayList<>();
        Map<String, String> values = new LinkedHashMap<>();

        for (String keyword : keywords) {
            if (keyword == null) continue;
            String normalizedKeyword = normalizer.normalize(keyword).trim();
            if (normalizedKeyword.isEmpty() || !normalizedText.contains(normalizedKeyword)) continue;

            matched.add(keyword);
            extractValue(text, keyword).ifPresent(v -> values.put(keyword, v));
        }

        log.debug("KeywordValueExtractor: parsed content, found {} keywords", matched.size());
        return new LabelledContent(matched, values);
    }
}
