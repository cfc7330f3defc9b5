package com.thicket.db.database;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.thicket.db.label.LabelResolver;
import com.thicket.db.model.DatabaseDocument;
import com.thicket.db.model.DatabaseInfo;
import com.thicket.db.model.ExtractorVersion;
import com.thicket.db.model.ModelRecord;
import com.thicket.db.model.ParsedModel;
import com.thicket.db.util.FileWriteUtil;
import com.thicket.db.util.JsonUtil;
import com.thicket.db.view.ModelView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The plant model database: a single JSON document holding the extractor info block,
 * the label table and the model table.
 *
 * Reads return freshly built {@link ModelView}s; the document itself is only changed
 * through {@link #initialize}, {@link #addModel} and {@link #updateLabels}, and only
 * written to disk by {@link #save}. Instances are not thread-safe.
 */
public class ModelDatabase implements Iterable<ModelView> {
    private static final Logger log = LoggerFactory.getLogger(ModelDatabase.class);

    public static final int SCHEMA_VERSION = 2;
    public static final String DEFAULT_LOCALE = "en-US";

    private final Path path;
    private final String locale;
    private DatabaseDocument document;

    private ModelDatabase(Path path, String locale) {
        this.path = path;
        this.locale = LabelResolver.normalizeLocale(locale == null ? DEFAULT_LOCALE : locale);
    }

    /**
     * An empty database bound to {@code path} without reading or writing it. Whatever is on
     * disk is only replaced on {@link #save()}.
     */
    public static ModelDatabase create(Path path, String locale, ExtractorVersion version) {
        ModelDatabase db = new ModelDatabase(path, locale);
        db.initialize(version);
        return db;
    }

    public static ModelDatabase open(Path path, String locale, boolean create) throws IOException {
        return open(path, locale, create, ExtractorVersion.UNKNOWN);
    }

    /**
     * Loads the database at {@code path}. When the file is missing and {@code create} is set,
     * an empty database stamped with {@code version} is written there instead.
     *
     * @throws DatabaseNotFoundException the file is missing and {@code create} is false
     * @throws StaleSchemaException the document predates {@link #SCHEMA_VERSION}
     * @throws CorruptDatabaseException the file is not a readable database document
     */
    public static ModelDatabase open(Path path, String locale, boolean create, ExtractorVersion version)
            throws IOException {
        ModelDatabase db = new ModelDatabase(path, locale);

        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            if (!create) {
                throw new DatabaseNotFoundException(path);
            }
            log.info("Creating new database: {}", path);
            db.initialize(version);
            db.save();
            return db;
        }

        DatabaseDocument loaded;
        try {
            loaded = JsonUtil.mapper().readValue(content, DatabaseDocument.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse database {}: {}", path, e.getOriginalMessage());
            throw new CorruptDatabaseException(path, e);
        }
        if (loaded == null) {
            log.error("Database {} is empty", path);
            throw new CorruptDatabaseException(path, new IOException("document is null"));
        }

        int found = loaded.getInfo() == null ? 0 : loaded.getInfo().getSchemaVersion();
        if (found < SCHEMA_VERSION) {
            log.warn("Database {} uses schema version {}, current is {}", path, found, SCHEMA_VERSION);
            throw new StaleSchemaException(path, found, SCHEMA_VERSION);
        }

        if (loaded.getLabels() == null) {
            loaded.setLabels(new LinkedHashMap<>());
        }
        if (loaded.getModels() == null) {
            loaded.setModels(new LinkedHashMap<>());
        }
        for (Map.Entry<String, ModelRecord> entry : loaded.getModels().entrySet()) {
            ModelRecord record = entry.getValue();
            if (record == null || (record.getVariants() != null && record.getVariants().containsValue(null))) {
                log.error("Database {} has an empty record for model \"{}\"", path, entry.getKey());
                throw new CorruptDatabaseException(path, "empty record for model " + entry.getKey());
            }
        }
        db.document = loaded;
        log.debug("Loaded {} models from {}", db.modelCount(), path);
        return db;
    }

    /**
     * Discards all content and starts an empty document at the current schema version.
     */
    public void initialize(ExtractorVersion version) {
        document = DatabaseDocument.empty(DatabaseInfo.of(version, SCHEMA_VERSION));
    }

    public void save() throws IOException {
        String json = JsonUtil.prettyMapper().writeValueAsString(document);
        FileWriteUtil.safeWriteString(path, json);
        log.debug("Saved {} models to {}", modelCount(), path);
    }

    public String getLocale() {
        return locale;
    }

    public DatabaseInfo getInfo() {
        return document.getInfo().toBuilder().build();
    }

    public int modelCount() {
        return document.getModels().size();
    }

    public String getLabel(String key) {
        return labelResolver().resolve(key);
    }

    public String getLabel(String key, String locale) {
        return labelResolver().resolve(key, locale);
    }

    /**
     * Finds a model by name, falling back to a scan by source file path when the name is
     * absent or unknown.
     */
    public Optional<ModelView> getModel(String filepath, String name) {
        Map<String, ModelRecord> models = document.getModels();
        ModelRecord found = name == null ? null : models.get(name);

        if (found == null && filepath != null) {
            for (ModelRecord record : models.values()) {
                if (filepath.equals(record.getFilepath())) {
                    found = record;
                    break;
                }
            }
        }

        return Optional.ofNullable(found).map(record -> ModelView.of(record, labelResolver()));
    }

    public Optional<ModelView> getModelByName(String name) {
        return getModel(null, name);
    }

    public Optional<ModelView> getModelByFilepath(String filepath) {
        return getModel(filepath, null);
    }

    /**
     * Inserts or replaces the model under its name and merges its labels.
     */
    public void addModel(ParsedModel parsed) {
        ModelRecord record = parsed.getModel();
        if (record == null || record.getName() == null) {
            throw new IllegalArgumentException("Parsed model has no model name");
        }
        document.getModels().put(record.getName(), record);
        updateLabels(parsed.getLabels());
    }

    /**
     * Shallow per-key merge: locales new to a key are added, existing (key, locale) pairs
     * are overwritten, other locales of the key are kept.
     */
    public void updateLabels(Map<String, Map<String, String>> labels) {
        if (labels == null) {
            return;
        }
        Map<String, Map<String, String>> table = document.getLabels();
        labels.forEach((key, byLocale) -> {
            if (byLocale != null) {
                table.computeIfAbsent(key, k -> new LinkedHashMap<>()).putAll(byLocale);
            }
        });
    }

    /**
     * A fresh pass over all models in ascending name order. Views are built as the
     * stream is consumed.
     */
    public Stream<ModelView> stream() {
        Map<String, ModelRecord> models = document.getModels();
        List<String> names = new ArrayList<>(models.keySet());
        Collections.sort(names);
        LabelResolver resolver = labelResolver();
        return names.stream()
                .map(models::get)
                .map(record -> ModelView.of(record, resolver));
    }

    @Override
    public Iterator<ModelView> iterator() {
        return stream().iterator();
    }

    DatabaseDocument document() {
        return document;
    }

    private LabelResolver labelResolver() {
        return new LabelResolver(document.getLabels(), locale);
    }
}
