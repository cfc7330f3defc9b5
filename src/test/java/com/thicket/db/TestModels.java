package com.thicket.db;

import com.thicket.db.model.ModelRecord;
import com.thicket.db.model.ParsedModel;
import com.thicket.db.model.VariantRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared fixtures for model records and labels.
 */
public final class TestModels {

    private TestModels() {}

    /**
     * A model with the given variants, each having seasons spring/summer (default summer).
     * The first variant is the default.
     */
    public static ModelRecord model(String name, String filepath, String... variantNames) {
        Map<String, VariantRecord> variants = new LinkedHashMap<>();
        for (int i = 0; i < variantNames.length; i++) {
            variants.put(variantNames[i], VariantRecord.builder()
                    .index(i)
                    .seasons(List.of("spring", "summer"))
                    .defaultSeason("summer")
                    .preview("")
                    .build());
        }
        return ModelRecord.builder()
                .name(name)
                .filepath(filepath)
                .md5("d41d8cd98f00b204e9800998ecf8427e")
                .defaultVariant(variantNames.length > 0 ? variantNames[0] : null)
                .preview("/plants/" + name + ".png")
                .variants(variants)
                .build();
    }

    public static ParsedModel parsed(String name, String... variantNames) {
        Map<String, Map<String, String>> labels = new LinkedHashMap<>();
        labels.put(name, new LinkedHashMap<>(Map.of("en", name + " (en)", "de", name + " (de)")));
        return new ParsedModel(model(name, "/plants/" + name + "/" + name + ".lbw.gz", variantNames), labels);
    }
}
