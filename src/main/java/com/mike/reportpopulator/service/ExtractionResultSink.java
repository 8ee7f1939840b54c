package com.mike.reportpopulator.service;

import com.mike.reportpopulator.dto.ExtractionResult;
import com.mike.reportpopulator.dto.InboundEmail;

/**
 * Receives one extraction result per processed message.
 */
public interface ExtractionResultSink {
    void accept(InboundEmail email, ExtractionResult result);
}
