package com.mike.reportpopulator.controller;

import com.mike.reportpopulator.exception.CatalogStoreException;
import com.mike.reportpopulator.exception.InvalidExtractionConfigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidExtractionConfigException.class)
    public ResponseEntity<String> invalidConfig(InvalidExtractionConfigException e) {
        log.warn("ApiExceptionHandler: invalid extraction config: {}", e.getMessage());
        return ResponseEntity.badRequest().body(e.getMessage());
    }

    @ExceptionHandler(CatalogStoreException.class)
    public ResponseEntity<String> catalogStore(CatalogStoreException e) {
        log.error("ApiExceptionHandler: catalog store failure: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Catalog store unavailable.");
    }
}
