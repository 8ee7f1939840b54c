package com.mike.reportpopulator.controller;

import com.mike.reportpopulator.service.catalog.JsonCatalogStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/catalog")
public class CatalogController {

    private final JsonCatalogStore catalogStore;

    public record CompanyRequest(String name) {}

    public record KeywordRequest(String keyword) {}

    public record CategoryRequest(String category) {}

    public record IncidentCodeRequest(String code, String description) {}

    @GetMapping("/companies")
    public List<String> companies() {
        return catalogStore.loadCompanies().names();
    }

    @PostMapping("/companies")
    public ResponseEntity<String> addCompany(@RequestBody CompanyRequest request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            return ResponseEntity.badRequest().body("Company name is required.");
        }
        return catalogStore.addCompany(request.name())
                ? ResponseEntity.status(HttpStatus.CREATED).body("Company added.")
                : ResponseEntity.ok("Company already exists.");
    }

    @DeleteMapping("/companies/{name}")
    public ResponseEntity<String> removeCompany(@PathVariable String name) {
        return catalogStore.removeCompany(name)
                ? ResponseEntity.ok("Company removed.")
                : ResponseEntity.status(HttpStatus.NOT_FOUND).body("Company not found.");
    }

    @GetMapping("/keywords")
    public Map<String, List<String>> keywords() {
        return catalogStore.loadKeywords().categories();
    }

    @PostMapping("/keywords/{category}")
    public ResponseEntity<String> addKeyword(@PathVariable String category, @RequestBody KeywordRequest request) {
        if (request == null || request.keyword() == null || request.keyword().isBlank()) {
            return ResponseEntity.badRequest().body("Keyword is required.");
        }
        return catalogStore.addKeyword(category, request.keyword())
                ? ResponseEntity.status(HttpStatus.CREATED).body("Keyword added.")
                : ResponseEntity.ok("Keyword already exists.");
    }

    @DeleteMapping("/keywords/{category}/{keyword}")
    public ResponseEntity<String> removeKeyword(@PathVariable String category, @PathVariable String keyword) {
        return catalogStore.removeKeyword(category, keyword)
                ? ResponseEntity.ok("Keyword removed.")
                : ResponseEntity.status(HttpStatus.NOT_FOUND).body("Keyword not found.");
    }

    @PostMapping("/keywords")
    public ResponseEntity<String> addCategory(@RequestBody CategoryRequest request) {
        if (request == null || request.category() == null || request.category().isBlank()) {
            return ResponseEntity.badRequest().body("Category is required.");
        }
        return catalogStore.addKeywordCategory(request.category())
                ? ResponseEntity.status(HttpStatus.CREATED).body("Category added.")
                : ResponseEntity.ok("Category already exists.");
    }

    @DeleteMapping("/keywords/{category}")
    public ResponseEntity<String> removeCategory(@PathVariable String category) {
        return catalogStore.removeKeywordCategory(category)
                ? ResponseEntity.ok("Category removed.")
                : ResponseEntity.status(HttpStatus.NOT_FOUND).body("Category not found.");
    }

    @GetMapping("/incident-codes")
    public Map<String, String> incidentCodes() {
        return catalogStore.loadIncidentCodes();
    }

    @PostMapping("/incident-codes")
    public ResponseEntity<String> addIncidentCode(@RequestBody IncidentCodeRequest request) {
        if (request == null || request.code() == null || request.code().isBlank()) {
            return ResponseEntity.badRequest().body("Incident code is required.");
        }
        return catalogStore.addIncidentCode(request.code(), request.description())
                ? ResponseEntity.status(HttpStatus.CREATED).body("Incident code added.")
                : ResponseEntity.ok("Incident code already exists.");
    }

    @PutMapping("/incident-codes/{code}")
    public ResponseEntity<String> updateIncidentCode(@PathVariable String code, @RequestBody IncidentCodeRequest request) {
        String description = request == null ? null : request.description();
        return catalogStore.updateIncidentCode(code, description)
                ? ResponseEntity.ok("Incident code updated.")
                : ResponseEntity.status(HttpStatus.NOT_FOUND).body("Incident code not found.");
    }

    @DeleteMapping("/incident-codes/{code}")
    public ResponseEntity<String> removeIncidentCode(@PathVariable String code) {
        return catalogStore.removeIncidentCode(code)
                ? ResponseEntity.ok("Incident code removed.")
                : ResponseEntity.status(HttpStatus.NOT_FOUND).body("Incident code not found.");
    }
}
