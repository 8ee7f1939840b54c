package com.mike.reportpopulator.dto;

import java.time.LocalDateTime;

public record InboundEmail(
        String messageId,
        String subject,
        String sender,
        LocalDateTime receivedAt,
        String body
) {
}
