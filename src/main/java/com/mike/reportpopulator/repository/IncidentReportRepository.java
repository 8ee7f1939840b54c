package com.mike.reportpopulator.repository;

import com.mike.reportpopulator.entity.IncidentReport;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface IncidentReportRepository extends JpaRepository<IncidentReport, Long> {
    boolean existsByMessageId(String messageId);
    Optional<IncidentReport> findByMessageId(String messageId);
    List<IncidentReport> findByReferenceIgnoreCaseOrderByReceivedAtDesc(String reference);
}
