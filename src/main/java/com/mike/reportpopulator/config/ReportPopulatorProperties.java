package com.mike.reportpopulator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@Data
@ConfigurationProperties(prefix = "reportpopulator")
public class ReportPopulatorProperties {

    private Catalog catalog = new Catalog();
    private Extraction extraction = new Extraction();

    @Data
    public static class Catalog {
        /**
         * Directory holding company_name.json, pre_defined_keywords.json and field_patterns.json.
         */
        private String directory = "config";

        /**
         * Copy the previous file to backups/ before every save.
         */
        private boolean backupOnSave = true;
    }

    @Data
    public static class Extraction {
        /**
         * Labels looked up as "Label: value" in every message.
         */
        private List<String> labels = List.of();
    }
}
