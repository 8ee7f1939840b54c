package com.mike.reportpopulator.service.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CompanyCatalogFile(List<String> companies) {

    public CompanyCatalogFile {
        companies = companies == null ? List.of() : companies;
    }

    static CompanyCatalogFile defaults() {
        return new CompanyCatalogFile(List.of());
    }
}
