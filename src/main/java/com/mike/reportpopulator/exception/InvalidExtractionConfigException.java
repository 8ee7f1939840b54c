package com.mike.reportpopulator.exception;

/**
 * Raised while building extraction configuration, never while extracting a message.
 */
public class InvalidExtractionConfigException extends RuntimeException {

    public InvalidExtractionConfigException(String message) {
        super(message);
    }

    public InvalidExtractionConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
