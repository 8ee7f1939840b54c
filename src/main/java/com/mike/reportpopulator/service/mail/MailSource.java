package com.mike.reportpopulator.service.mail;

import com.mike.reportpopulator.dto.InboundEmail;

import java.time.LocalDateTime;
import java.util.List;

public interface MailSource {

    /**
     * Messages received strictly after {@code since}, oldest first.
     */
    List<InboundEmail> fetchReceivedAfter(LocalDateTime since);
}
