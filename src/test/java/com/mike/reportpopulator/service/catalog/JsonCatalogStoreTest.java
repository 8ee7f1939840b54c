package com.mike.reportpopulator.service.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mike.reportpopulator.config.ReportPopulatorProperties;
import com.mike.reportpopulator.exception.CatalogStoreException;
import com.mike.reportpopulator.exception.InvalidExtractionConfigException;
import com.mike.reportpopulator.service.extraction.CompanyCatalog;
import com.mike.reportpopulator.service.extraction.ExtractionConfig;
import com.mike.reportpopulator.service.extraction.KeywordCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonCatalogStoreTest {

    @TempDir
    Path configDir;

    private ReportPopulatorProperties properties;
    private JsonCatalogStore store;

    @BeforeEach
    void setUp() {
        properties = new ReportPopulatorProperties();
        properties.getCatalog().setDirectory(configDir.toString());
        properties.getExtraction().setLabels(List.of("Status"));
        store = new JsonCatalogStore(new ObjectMapper(), properties);
    }

    @Nested
    @DisplayName("defaults")
    class Defaults {

        @Test
        @DisplayName("missing company file -> created empty")
        void companies_default() {
            //Act
            CompanyCatalog catalog = store.loadCompanies();
            //Assert
            assertTrue(catalog.isEmpty());
            assertTrue(Files.exists(configDir.resolve(JsonCatalogStore.COMPANIES_FILE)));
        }

        @Test
        @DisplayName("missing keyword file -> default categories")
        void keywords_default() {
            //Act
            KeywordCatalog catalog = store.loadKeywords();
            //Assert
            assertEquals(List.of("Incident Type", "Priority", "Status"), List.copyOf(catalog.categories().keySet()));
            assertTrue(catalog.categories().get("Status").contains("ongoing"));
        }

        @Test
        @DisplayName("extraction config combines files and configured labels")
        void extraction_config() {
            //Act
            ExtractionConfig config = store.loadExtractionConfig();
            //Assert
            assertTrue(config.companies().isEmpty());
            assertEquals(3, config.keywords().categories().size());
            assertEquals(List.of("Status"), config.labels());
            assertTrue(config.fields().isEmpty());
        }
    }

    @Nested
    @DisplayName("companies")
    class Companies {

        @Test
        @DisplayName("add persists, duplicate add is a no-op")
        void add_company() {
            assertTrue(store.addCompany("Example Corp"));
            assertFalse(store.addCompany("Example Corp"));
            assertEquals(List.of("Example Corp"), store.loadCompanies().names());
        }

        @Test
        @DisplayName("remove unknown -> false")
        void remove_unknown() {
            assertFalse(store.removeCompany("Nobody"));
        }

        @Test
        @DisplayName("save keeps a backup of the previous file")
        void backup_created() throws IOException {
            //Act
            store.addCompany("Example Corp");
            store.removeCompany("Example Corp");
            //Assert
            Path backups = configDir.resolve(JsonCatalogStore.BACKUP_DIR);
            try (Stream<Path> files = Files.list(backups)) {
                assertTrue(files.anyMatch(p -> p.getFileName().toString().startsWith("company_name_")));
            }
            assertTrue(store.loadCompanies().isEmpty());
        }

        @Test
        @DisplayName("backups disabled -> no backup directory")
        void backup_disabled() {
            //Arrange
            properties.getCatalog().setBackupOnSave(false);
            //Act
            store.addCompany("Example Corp");
            store.addCompany("Demo Inc");
            //Assert
            assertFalse(Files.exists(configDir.resolve(JsonCatalogStore.BACKUP_DIR)));
        }
    }

    @Nested
    @DisplayName("keywords")
    class Keywords {

        @Test
        @DisplayName("add to new category creates it")
        void add_new_category() {
            //Act
            boolean added = store.addKeyword("Region", "emea");
            //Assert
            assertTrue(added);
            assertEquals(List.of("emea"), store.loadKeywords().categories().get("Region"));
        }

        @Test
        @DisplayName("removing the last keyword drops the category")
        void remove_last_keyword() {
            //Arrange
            store.addKeyword("Region", "emea");
            //Act
            boolean removed = store.removeKeyword("Region", "emea");
            //Assert
            assertTrue(removed);
            assertFalse(store.loadKeywords().categories().containsKey("Region"));
        }

        @Test
        @DisplayName("duplicate or unknown keyword -> false")
        void duplicate_and_unknown() {
            assertFalse(store.addKeyword("Priority", "high"));
            assertFalse(store.removeKeyword("Priority", "whenever"));
            assertFalse(store.removeKeyword("Nope", "high"));
        }
    }

    @Nested
    @DisplayName("broken files")
    class BrokenFiles {

        @Test
        @DisplayName("field pattern without group -> config error at load")
        void invalid_field_pattern() throws IOException {
            //Arrange
            Files.writeString(configDir.resolve(JsonCatalogStore.FIELDS_FILE),
                    "{\"fields\": {\"status\": [\"Status:\\\\s*\\\\w+\"]}}");
            //Act Assert
            assertThrows(InvalidExtractionConfigException.class, () -> store.loadFieldPatterns());
        }

        @Test
        @DisplayName("valid field pattern file is compiled")
        void valid_field_pattern() throws IOException {
            //Arrange
            Files.writeString(configDir.resolve(JsonCatalogStore.FIELDS_FILE),
                    "{\"fields\": {\"status\": [\"Status:\\\\s*(\\\\w+)\"]}}");
            //Act Assert
            assertEquals(1, store.loadFieldPatterns().asMap().get("status").size());
        }

        @Test
        @DisplayName("malformed JSON -> CatalogStoreException")
        void malformed_json() throws IOException {
            //Arrange
            Files.writeString(configDir.resolve(JsonCatalogStore.COMPANIES_FILE), "{ not json");
            //Act Assert
            assertThrows(CatalogStoreException.class, () -> store.loadCompanies());
        }
    }

    @Nested
    @DisplayName("keyword categories")
    class KeywordCategories {

        @Test
        @DisplayName("add creates an empty category, duplicate add is a no-op")
        void add_category() {
            assertTrue(store.addKeywordCategory("Region"));
            assertFalse(store.addKeywordCategory("Region"));
            assertEquals(List.of(), store.loadKeywords().categories().get("Region"));
        }

        @Test
        @DisplayName("remove drops the category with its keywords")
        void remove_category() {
            //Act
            boolean removed = store.removeKeywordCategory("Priority");
            //Assert
            assertTrue(removed);
            assertFalse(store.loadKeywords().categories().containsKey("Priority"));
            assertFalse(store.removeKeywordCategory("Priority"));
        }
    }

    @Nested
    @DisplayName("incident codes")
    class IncidentCodes {

        @Test
        @DisplayName("missing file -> created empty")
        void default_file() {
            assertTrue(store.loadIncidentCodes().isEmpty());
            assertTrue(Files.exists(configDir.resolve(JsonCatalogStore.INCIDENT_CODES_FILE)));
        }

        @Test
        @DisplayName("add, update, remove")
        void lifecycle() throws IOException {
            //Act
            assertTrue(store.addIncidentCode("INC", "Incident"));
            assertFalse(store.addIncidentCode("INC", "Other"));
            assertTrue(store.updateIncidentCode("INC", "Service incident"));
            //Assert
            assertEquals(Map.of("INC", "Service incident"), store.loadIncidentCodes());
            assertTrue(Files.readString(configDir.resolve(JsonCatalogStore.INCIDENT_CODES_FILE))
                    .contains("\"incident_codes\""));
            assertTrue(store.removeIncidentCode("INC"));
            assertTrue(store.loadIncidentCodes().isEmpty());
        }

        @Test
        @DisplayName("update or remove unknown code -> false")
        void unknown_code() {
            assertFalse(store.updateIncidentCode("CHG", "Change"));
            assertFalse(store.removeIncidentCode("CHG"));
        }
    }

    @Nested
    @DisplayName("concurrent use")
    class ConcurrentUse {

        @Test
        @DisplayName("loads running alongside saves never see a partial file")
        void loads_during_saves() throws Exception {
            //Arrange
            properties.getCatalog().setBackupOnSave(false);
            for (int i = 0; i < 300; i++) {
                store.addCompany("Company number " + i);
            }
            AtomicBoolean saving = new AtomicBoolean(true);
            AtomicInteger failedLoads = new AtomicInteger();
            AtomicInteger loads = new AtomicInteger();
            Thread loader = new Thread(() -> {
                while (saving.get()) {
                    try {
                        store.loadCompanies();
                        loads.incrementAndGet();
                    } catch (RuntimeException e) {
                        failedLoads.incrementAndGet();
                    }
                }
            });
            //Act
            loader.start();
            for (int i = 0; i < 400; i++) {
                store.addCompany("Transient Ltd");
                store.removeCompany("Transient Ltd");
            }
            saving.set(false);
            loader.join(10_000);
            //Assert
            assertEquals(0, failedLoads.get());
            assertTrue(loads.get() > 0);
            assertEquals(300, store.loadCompanies().names().size());
        }
    }
}
