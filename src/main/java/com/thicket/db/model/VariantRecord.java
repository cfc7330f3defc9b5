package com.thicket.db.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Persisted variant of a model. {@code defaultSeason} is always one of {@code seasons};
 * an empty {@code preview} means the model preview applies.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class VariantRecord {
    private int index;
    private List<String> seasons;
    private String defaultSeason;
    private String preview;
}
