package com.mike.reportpopulator.controller;

import com.mike.reportpopulator.dto.ExtractionResult;
import com.mike.reportpopulator.exception.CatalogStoreException;
import com.mike.reportpopulator.exception.InvalidExtractionConfigException;
import com.mike.reportpopulator.service.catalog.JsonCatalogStore;
import com.mike.reportpopulator.service.extraction.ExtractionConfig;
import com.mike.reportpopulator.service.extraction.StructuredDataExtractor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.*;

class ExtractionControllerTest {

    private final StructuredDataExtractor extractor = mock(StructuredDataExtractor.class);
    private final JsonCatalogStore catalogStore = mock(JsonCatalogStore.class);
    private final ExtractionController controller = new ExtractionController(extractor, catalogStore);
    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    @DisplayName("text is extracted with the stored catalogs")
    void extract() {
        //Arrange
        ExtractionConfig config = ExtractionConfig.empty();
        ExtractionResult result = ExtractionResult.builder().reference("INC-1").build();
        when(catalogStore.loadExtractionConfig()).thenReturn(config);
        when(extractor.extract("Incident: INC-1", config)).thenReturn(result);
        //Act
        ResponseEntity<ExtractionResult> response = controller.extract(new ExtractionController.ExtractionRequest("Incident: INC-1"));
        //Assert
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertSame(result, response.getBody());
    }

    @Test
    @DisplayName("missing text -> 400")
    void missing_text() {
        assertEquals(HttpStatus.BAD_REQUEST, controller.extract(new ExtractionController.ExtractionRequest(null)).getStatusCode());
    }

    @Test
    @DisplayName("config and store errors map to 400 and 500")
    void exception_mapping() {
        assertEquals(HttpStatus.BAD_REQUEST,
                handler.invalidConfig(new InvalidExtractionConfigException("bad pattern")).getStatusCode());
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR,
                handler.catalogStore(new CatalogStoreException("disk", new IOException("full"))).getStatusCode());
    }
}
