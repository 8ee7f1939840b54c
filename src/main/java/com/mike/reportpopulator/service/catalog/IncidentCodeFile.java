package com.mike.reportpopulator.service.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Known incident reference codes with a free-text description each.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncidentCodeFile(@JsonProperty("incident_codes") Map<String, String> incidentCodes) {

    public IncidentCodeFile {
        incidentCodes = incidentCodes == null ? Map.of() : incidentCodes;
    }

    static IncidentCodeFile defaults() {
        return new IncidentCodeFile(Map.of());
    }
}
