package com.mike.reportpopulator.exception;

public class MailSourceException extends RuntimeException {

    public MailSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
