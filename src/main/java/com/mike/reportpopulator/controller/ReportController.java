package com.mike.reportpopulator.controller;

import com.mike.reportpopulator.entity.IncidentReport;
import com.mike.reportpopulator.repository.IncidentReportRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/reports")
public class ReportController {

    private final IncidentReportRepository repository;

    /**
     * Reports for one incident reference, newest message first.
     */
    @GetMapping(params = "reference")
    public List<IncidentReport> byReference(@RequestParam String reference) {
        return repository.findByReferenceIgnoreCaseOrderByReceivedAtDesc(reference.trim());
    }

    // Message ids contain '<', '>' and '@', so they travel as a query parameter.
    @GetMapping(params = "messageId")
    public ResponseEntity<IncidentReport> byMessageId(@RequestParam String messageId) {
        return repository.findByMessageId(messageId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
