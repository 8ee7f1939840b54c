package com.mike.reportpopulator.service.extraction;

import com.mike.reportpopulator.dto.ExtractionResult;
import com.mike.reportpopulator.dto.LabelledContent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs every extractor over one message body. Stateless: the same text and config
 * always give the same result, and calls may run concurrently.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StructuredDataExtractor {

    private final CompanyNameResolver companyNameResolver;
    private final IncidentReferenceExtractor referenceExtractor;
    private final DateTimeExtractor dateTimeExtractor;
    private final KeywordCategorizer keywordCategorizer;
    private final KeywordValueExtractor keywordValueExtractor;

    public ExtractionResult extract(String text, ExtractionConfig config) {
        String body = text == null ? "" : text;
        ExtractionConfig cfg = config == null ? ExtractionConfig.empty() : config;

        ExtractionResult.ExtractionResultBuilder result = ExtractionResult.builder();

        if (cfg.companies() != null) {
            companyNameResolver.resolve(body, cfg.companies()).ifPresent(result::company);
        }
        referenceExtractor.extract(body).ifPresent(result::reference);
        dateTimeExtractor.extract(body).ifPresent(result::datetime);

        if (cfg.keywords() != null) {
            result.keywordsByCategory(keywordCategorizer.categorize(body, cfg.keywords()));
        }
        if (cfg.labels() != null) {
            LabelledContent labelled = keywordValueExtractor.parseContent(body, cfg.labels());
            result.matchedKeywords(labelled.matchedKeywords());
            result.extractedData(labelled.extractedData());
        }
        if (cfg.fields() != null) {
            result.fields(extractFields(body, cfg.fields()));
        }

        ExtractionResult built = result.build();
        log.debug("StructuredDataExtractor: {}", built.toLogLine());
        return built;
    }

    private Map<String, String> extractFields(String text, FieldPatternMap fields) {
        Map<String, String> values = new LinkedHashMap<>();
        for (Map.Entry<String, List<Pattern>> entry : fields.asMap().entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                Matcher matcher = pattern.matcher(text);
                if (matcher.find() && matcher.group(1) != null) {
                    values.put(entry.getKey(), matcher.group(1).trim());
                    break;
                }
            }
        }
        return Collections.unmodifiableMap(values);
    }
}
