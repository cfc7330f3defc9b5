package com.thicket.db.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One extracted asset: the model record plus the labels for the model, its variants
 * and its seasons. This is also the JSON object a worker prints on success.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ParsedModel {
    private ModelRecord model;
    private Map<String, Map<String, String>> labels;
}
