package com.mike.reportpopulator.service.extraction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
@Slf4j
public class CompanyNameResolver {

    private static final List<Pattern> LABEL_PATTERNS = List.of(
            Pattern.compile("company[:\\s]+([^,\\n\\r]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("organization[:\\s]+([^,\\n\\r]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("client[:\\s]+([^,\\n\\r]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("customer[:\\s]+([^,\\n\\r]+)", Pattern.CASE_INSENSITIVE)
    );

    /**
     * Returns the catalog entry (verbatim) that the text refers to. Labelled mentions
     * ({@code Company: ...}) win over bare mentions; within each phase the longest
     * name wins.
     */
    public Optional<String> resolve(String text, CompanyCatalog catalog) {
        if (text == null || text.isEmpty() || catalog == null || catalog.isEmpty()) {
            return Optional.empty();
        }
        List<String> candidates = catalog.longestFirst();

        for (Pattern label : LABEL_PATTERNS) {
            Matcher matcher = label.matcher(text);
            if (!matcher.find()) continue;

            String labelled = matcher.group(1).trim().toLowerCase(Locale.ROOT);
            for (String company : candidates) {
                if (labelled.contains(company.toLowerCase(Locale.ROOT))) {
                    log.debug("CompanyNameResolver: labelled match company='{}'", company);
                    return Optional.of(company);
                }
            }
        }

        for (String company : candidates) {
            Pattern standalone = Pattern.compile("\\b" + Pattern.quote(company) + "\\b", Pattern.CASE_INSENSITIVE);
            if (standalone.matcher(text).find()) {
                log.debug("CompanyNameResolver: direct match company='{}'", company);
                return Optional.of(company);
            }
        }

        log.debug("CompanyNameResolver: no company found");
        return Optional.empty();
    }
}
