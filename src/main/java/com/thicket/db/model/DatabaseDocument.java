package com.thicket.db.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the persisted database: {@code info}, {@code labels} and {@code models}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseDocument {
    private DatabaseInfo info;
    private Map<String, Map<String, String>> labels;
    private Map<String, ModelRecord> models;

    public static DatabaseDocument empty(DatabaseInfo info) {
        return new DatabaseDocument(info, new LinkedHashMap<>(), new LinkedHashMap<>());
    }
}
