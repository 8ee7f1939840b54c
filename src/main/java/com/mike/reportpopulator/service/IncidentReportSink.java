package com.mike.reportpopulator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mike.reportpopulator.dto.ExtractionResult;
import com.mike.reportpopulator.dto.InboundEmail;
import com.mike.reportpopulator.entity.IncidentReport;
import com.mike.reportpopulator.repository.IncidentReportRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class IncidentReportSink implements ExtractionResultSink {

    private final IncidentReportRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional
    public void accept(InboundEmail email, ExtractionResult result) {
        if (repository.existsByMessageId(email.messageId())) {
            log.info("IncidentReportSink: message already stored, skipping (messageId={})", email.messageId());
            return;
        }

        IncidentReport report = IncidentReport.builder()
                .messageId(email.messageId())
                .subject(email.subject())
                .sender(email.sender())
                .receivedAt(email.receivedAt())
                .company(result.getCompany())
                .reference(result.getReference())
                .occurredAt(result.getDatetime())
                .keywordsJson(toJson(result.getKeywordsByCategory()))
                .fieldsJson(toJson(result.getFields()))
                .build();

        repository.save(report);
        log.info("IncidentReportSink: stored report (messageId={}, reference={}, company={})",
                email.messageId(), result.getReference(), result.getCompany());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize extraction result", e);
        }
    }
}
