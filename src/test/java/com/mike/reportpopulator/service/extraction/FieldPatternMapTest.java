package com.mike.reportpopulator.service.extraction;

import com.mike.reportpopulator.exception.InvalidExtractionConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldPatternMapTest {

    @Test
    @DisplayName("pattern without capturing group -> fails at load")
    void missing_group() {
        InvalidExtractionConfigException ex = assertThrows(InvalidExtractionConfigException.class,
                () -> FieldPatternMap.compile(Map.of("status", List.of("Status:\\s*\\w+"))));
        assertTrue(ex.getMessage().contains("status"));
    }

    @Test
    @DisplayName("invalid syntax -> fails at load")
    void invalid_syntax() {
        assertThrows(InvalidExtractionConfigException.class,
                () -> FieldPatternMap.compile(Map.of("status", List.of("Status:(\\w+"))));
    }

    @Test
    @DisplayName("non-capturing group alone is not enough")
    void non_capturing_only() {
        assertThrows(InvalidExtractionConfigException.class,
                () -> FieldPatternMap.compile(Map.of("owner", List.of("Owner:(?:\\s*)\\w+"))));
    }

    @Test
    @DisplayName("valid map keeps field and pattern order")
    void keeps_order() {
        //Arrange
        Map<String, List<String>> source = new LinkedHashMap<>();
        source.put("owner", List.of("Owner:\\s*(.+)", "Assignee:\\s*(.+)"));
        source.put("status", List.of("Status:\\s*(\\w+)"));
        //Act
        FieldPatternMap map = FieldPatternMap.compile(source);
        //Assert
        assertEquals(List.of("owner", "status"), List.copyOf(map.asMap().keySet()));
        assertEquals("Assignee:\\s*(.+)", map.asMap().get("owner").get(1).pattern());
    }

    @Test
    @DisplayName("null or empty source -> empty map")
    void empty_source() {
        assertSame(FieldPatternMap.empty(), FieldPatternMap.compile(null));
        assertTrue(FieldPatternMap.compile(Map.of()).isEmpty());
    }
}
