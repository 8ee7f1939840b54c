package com.mike.reportpopulator.service.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mike.reportpopulator.config.ReportPopulatorProperties;
import com.mike.reportpopulator.exception.CatalogStoreException;
import com.mike.reportpopulator.service.extraction.CompanyCatalog;
import com.mike.reportpopulator.service.extraction.ExtractionConfig;
import com.mike.reportpopulator.service.extraction.FieldPatternMap;
import com.mike.reportpopulator.service.extraction.KeywordCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * JSON files backing the company, keyword, field and incident code catalogs. A missing
 * file is created with default content on first read. Saves are serialized and replace
 * the file in one move, so loads may run alongside them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonCatalogStore {

    static final String COMPANIES_FILE = "company_name.json";
    static final String KEYWORDS_FILE = "pre_defined_keywords.json";
    static final String FIELDS_FILE = "field_patterns.json";
    static final String INCIDENT_CODES_FILE = "incident_ref_code.json";
    static final String BACKUP_DIR = "backups";

    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper objectMapper;
    private final ReportPopulatorProperties properties;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public CompanyCatalog loadCompanies() {
        return new CompanyCatalog(read(COMPANIES_FILE, CompanyCatalogFile.class, CompanyCatalogFile::defaults).companies());
    }

    public KeywordCatalog loadKeywords() {
        return new KeywordCatalog(read(KEYWORDS_FILE, KeywordCatalogFile.class, KeywordCatalogFile::defaults).categories());
    }

    /**
     * @throws com.mike.reportpopulator.exception.InvalidExtractionConfigException if a
     *         stored pattern does not compile or has no capturing group
     */
    public FieldPatternMap loadFieldPatterns() {
        return FieldPatternMap.compile(read(FIELDS_FILE, FieldPatternFile.class, FieldPatternFile::defaults).fields());
    }

    public ExtractionConfig loadExtractionConfig() {
        return ExtractionConfig.builder()
                .companies(loadCompanies())
                .keywords(loadKeywords())
                .labels(properties.getExtraction().getLabels())
                .fields(loadFieldPatterns())
                .build();
    }

    public Map<String, String> loadIncidentCodes() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(
                read(INCIDENT_CODES_FILE, IncidentCodeFile.class, IncidentCodeFile::defaults).incidentCodes()));
    }

    public boolean addCompany(String name) {
        if (name == null || name.isBlank()) return false;

        return locked(() -> {
            List<String> companies = new ArrayList<>(
                    read(COMPANIES_FILE, CompanyCatalogFile.class, CompanyCatalogFile::defaults).companies());
            if (companies.contains(name)) {
                log.warn("JsonCatalogStore: company '{}' already exists", name);
                return false;
            }
            companies.add(name);
            write(COMPANIES_FILE, new CompanyCatalogFile(companies));
            log.info("JsonCatalogStore: added company '{}'", name);
            return true;
        });
    }

    public boolean removeCompany(String name) {
        return locked(() -> {
            List<String> companies = new ArrayList<>(
                    read(COMPANIES_FILE, CompanyCatalogFile.class, CompanyCatalogFile::defaults).companies());
            if (!companies.remove(name)) {
                log.warn("JsonCatalogStore: company '{}' not found", name);
                return false;
            }
            write(COMPANIES_FILE, new CompanyCatalogFile(companies));
            log.info("JsonCatalogStore: removed company '{}'", name);
            return true;
        });
    }

    public boolean addKeyword(String category, String keyword) {
        if (category == null || category.isBlank() || keyword == null || keyword.isBlank()) return false;

        return locked(() -> {
            Map<String, List<String>> categories = mutableCategories();
            List<String> keywords = categories.computeIfAbsent(category, c -> new ArrayList<>());
            if (keywords.contains(keyword)) {
                log.warn("JsonCatalogStore: keyword '{}' already exists in category '{}'", keyword, category);
                return false;
            }
            keywords.add(keyword);
            write(KEYWORDS_FILE, new KeywordCatalogFile(categories));
            log.info("JsonCatalogStore: added keyword '{}' to category '{}'", keyword, category);
            return true;
        });
    }

    /**
     * Drops the category once its last keyword is gone.
     */
    public boolean removeKeyword(String category, String keyword) {
        return locked(() -> {
            Map<String, List<String>> categories = mutableCategories();
            List<String> keywords = categories.get(category);
            if (keywords == null || !keywords.remove(keyword)) {
                log.warn("JsonCatalogStore: keyword '{}' not found in category '{}'", keyword, category);
                return false;
            }
            if (keywords.isEmpty()) categories.remove(category);
            write(KEYWORDS_FILE, new KeywordCatalogFile(categories));
            log.info("JsonCatalogStore: removed keyword '{}' from category '{}'", keyword, category);
            return true;
        });
    }

    /**
     * Creates an empty category. It stays in the file until it is removed or gets and
     * then loses a keyword.
     */
    public boolean addKeywordCategory(String category) {
        if (category == null || category.isBlank()) return false;

        return locked(() -> {
            Map<String, List<String>> categories = mutableCategories();
            if (categories.containsKey(category)) {
                log.warn("JsonCatalogStore: category '{}' already exists", category);
                return false;
            }
            categories.put(category, new ArrayList<>());
            write(KEYWORDS_FILE, new KeywordCatalogFile(categories));
            log.info("JsonCatalogStore: added category '{}'", category);
            return true;
        });
    }

    public boolean removeKeywordCategory(String category) {
        return locked(() -> {
            Map<String, List<String>> categories = mutableCategories();
            if (categories.remove(category) == null) {
                log.warn("JsonCatalogStore: category '{}' not found", category);
                return false;
            }
            write(KEYWORDS_FILE, new KeywordCatalogFile(categories));
            log.info("JsonCatalogStore: removed category '{}' with its keywords", category);
            return true;
        });
    }

    public boolean addIncidentCode(String code, String description) {
        if (code == null || code.isBlank()) return false;

        return locked(() -> {
            Map<String, String> codes = mutableIncidentCodes();
            if (codes.containsKey(code)) {
                log.warn("JsonCatalogStore: incident code '{}' already exists", code);
                return false;
            }
            codes.put(code, description == null ? "" : description);
            write(INCIDENT_CODES_FILE, new IncidentCodeFile(codes));
            log.info("JsonCatalogStore: added incident code '{}'", code);
            return true;
        });
    }

    public boolean updateIncidentCode(String code, String description) {
        return locked(() -> {
            Map<String, String> codes = mutableIncidentCodes();
            if (!codes.containsKey(code)) {
                log.warn("JsonCatalogStore: incident code '{}' not found", code);
                return false;
            }
            codes.put(code, description == null ? "" : description);
            write(INCIDENT_CODES_FILE, new IncidentCodeFile(codes));
            log.info("JsonCatalogStore: updated incident code '{}'", code);
            return true;
        });
    }

    public boolean removeIncidentCode(String code) {
        return locked(() -> {
            Map<String, String> codes = mutableIncidentCodes();
            if (!codes.containsKey(code)) {
                log.warn("JsonCatalogStore: incident code '{}' not found", code);
                return false;
            }
            codes.remove(code);
            write(INCIDENT_CODES_FILE, new IncidentCodeFile(codes));
            log.info("JsonCatalogStore: removed incident code '{}'", code);
            return true;
        });
    }

    private Map<String, List<String>> mutableCategories() {
        Map<String, List<String>> categories = new LinkedHashMap<>();
        read(KEYWORDS_FILE, KeywordCatalogFile.class, KeywordCatalogFile::defaults).categories()
                .forEach((category, keywords) -> categories.put(category, new ArrayList<>(keywords)));
        return categories;
    }

    private Map<String, String> mutableIncidentCodes() {
        return new LinkedHashMap<>(
                read(INCIDENT_CODES_FILE, IncidentCodeFile.class, IncidentCodeFile::defaults).incidentCodes());
    }

    private boolean locked(BooleanSupplier change) {
        lock.writeLock().lock();
        try {
            return change.getAsBoolean();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T read(String fileName, Class<T> type, Supplier<T> defaults) {
        Path path = directory().resolve(fileName);

        lock.readLock().lock();
        try {
            if (Files.exists(path)) return parse(path, type);
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            if (Files.exists(path)) return parse(path, type);

            log.warn("JsonCatalogStore: {} not found, creating default", path);
            T created = defaults.get();
            write(fileName, created);
            return created;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T parse(Path path, Class<T> type) {
        try {
            T value = objectMapper.readValue(path.toFile(), type);
            log.debug("JsonCatalogStore: loaded {}", path);
            return value;
        } catch (IOException e) {
            throw new CatalogStoreException("Cannot read catalog file " + path, e);
        }
    }

    // Callers hold the write lock. The new content is written next to the target and
    // moved over it, so a reader never sees a partly written file.
    private void write(String fileName, Object value) {
        Path path = directory().resolve(fileName);
        try {
            Files.createDirectories(path.getParent());
            if (properties.getCatalog().isBackupOnSave() && Files.exists(path)) {
                backup(path);
            }
            Path temp = Files.createTempFile(path.getParent(), fileName, ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), value);
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
            log.debug("JsonCatalogStore: saved {}", path);
        } catch (IOException e) {
            throw new CatalogStoreException("Cannot write catalog file " + path, e);
        }
    }

    private void backup(Path path) throws IOException {
        Path backupDir = path.getParent().resolve(BACKUP_DIR);
        Files.createDirectories(backupDir);

        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String name = dot < 0 ? fileName : fileName.substring(0, dot);
        String ext = dot < 0 ? "" : fileName.substring(dot);

        Path target = backupDir.resolve(name + "_" + LocalDateTime.now().format(BACKUP_STAMP) + ext);
        Files.copy(path, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        log.debug("JsonCatalogStore: created backup {}", target);
    }

    private Path directory() {
        return Path.of(properties.getCatalog().getDirectory()).toAbsolutePath();
    }
}
