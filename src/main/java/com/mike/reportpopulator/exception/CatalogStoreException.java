package com.mike.reportpopulator.exception;

public class CatalogStoreException extends RuntimeException {

    public CatalogStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
