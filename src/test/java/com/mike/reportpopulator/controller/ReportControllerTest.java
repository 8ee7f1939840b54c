package com.mike.reportpopulator.controller;

import com.mike.reportpopulator.entity.IncidentReport;
import com.mike.reportpopulator.repository.IncidentReportRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ReportControllerTest {

    private final IncidentReportRepository repository = mock(IncidentReportRepository.class);
    private final ReportController controller = new ReportController(repository);

    @Test
    @DisplayName("search by reference -> repository order kept")
    void by_reference() {
        //Arrange
        IncidentReport newer = IncidentReport.builder().messageId("<2@example.com>").reference("INC-2025-001").build();
        IncidentReport older = IncidentReport.builder().messageId("<1@example.com>").reference("INC-2025-001").build();
        when(repository.findByReferenceIgnoreCaseOrderByReceivedAtDesc("inc-2025-001")).thenReturn(List.of(newer, older));
        //Act
        List<IncidentReport> reports = controller.byReference(" inc-2025-001 ");
        //Assert
        assertEquals(List.of(newer, older), reports);
    }

    @Test
    @DisplayName("lookup by message id -> 200 when stored, 404 otherwise")
    void by_message_id() {
        //Arrange
        IncidentReport stored = IncidentReport.builder().messageId("<1@example.com>").build();
        when(repository.findByMessageId("<1@example.com>")).thenReturn(Optional.of(stored));
        when(repository.findByMessageId("<2@example.com>")).thenReturn(Optional.empty());
        //Act
        ResponseEntity<IncidentReport> found = controller.byMessageId("<1@example.com>");
        ResponseEntity<IncidentReport> missing = controller.byMessageId("<2@example.com>");
        //Assert
        assertSame(stored, found.getBody());
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
    }
}
