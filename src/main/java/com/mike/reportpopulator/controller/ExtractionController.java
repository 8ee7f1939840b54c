package com.mike.reportpopulator.controller;

import com.mike.reportpopulator.dto.ExtractionResult;
import com.mike.reportpopulator.service.catalog.JsonCatalogStore;
import com.mike.reportpopulator.service.extraction.StructuredDataExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/extraction")
public class ExtractionController {

    private final StructuredDataExtractor extractor;
    private final JsonCatalogStore catalogStore;

    public record ExtractionRequest(String text) {}

    @PostMapping
    public ResponseEntity<ExtractionResult> extract(@RequestBody ExtractionRequest request) {
        if (request == null || request.text() == null) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(extractor.extract(request.text(), catalogStore.loadExtractionConfig()));
    }
}
