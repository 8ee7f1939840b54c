package com.mike.reportpopulator.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "incident_reports")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IncidentReport {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 998)
    private String messageId;

    private String subject;

    private String sender;

    private LocalDateTime receivedAt;

    private String company;

    private String reference;

    private LocalDateTime occurredAt;

    // category -> keywords, stored as JSON
    @Column(columnDefinition = "text")
    private String keywordsJson;

    // configured field -> value, stored as JSON
    @Column(columnDefinition = "text")
    private String fieldsJson;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }
}
