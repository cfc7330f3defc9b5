package com.thicket.db.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Persisted model entry, keyed by {@code name} in the database's model table.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ModelRecord {
    private String name;
    private String filepath;
    private String md5;
    private String defaultVariant;
    private String preview;
    private Map<String, VariantRecord> variants;
}
