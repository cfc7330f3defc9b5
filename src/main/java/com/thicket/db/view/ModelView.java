package com.thicket.db.view;

import com.thicket.db.label.LabelResolver;
import com.thicket.db.model.ModelRecord;
import com.thicket.db.model.VariantRecord;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only projection of a {@link ModelRecord} with labels resolved for one locale.
 *
 * Views are built from the record on every lookup and share no mutable state with the
 * database; variants are ordered by name.
 */
@Value
public class ModelView {
    String name;
    String label;
    String md5;
    String filepath;
    List<VariantView> variants;
    VariantView defaultVariant;
    String preview;

    public static ModelView of(ModelRecord record, LabelResolver resolver) {
        String preview = record.getPreview() == null ? "" : record.getPreview();

        Map<String, VariantRecord> sorted = new TreeMap<>();
        if (record.getVariants() != null) {
            sorted.putAll(record.getVariants());
        }

        List<VariantView> variants = new ArrayList<>(sorted.size());
        VariantView defaultVariant = null;
        for (Map.Entry<String, VariantRecord> entry : sorted.entrySet()) {
            VariantView view = VariantView.of(entry.getKey(), entry.getValue(), preview, resolver);
            variants.add(view);
            if (entry.getKey().equals(record.getDefaultVariant())) {
                defaultVariant = view;
            }
        }
        if (defaultVariant == null && !variants.isEmpty()) {
            defaultVariant = variants.get(0);
        }

        return new ModelView(record.getName(), resolver.resolve(record.getName()), record.getMd5(),
                record.getFilepath(), Collections.unmodifiableList(variants), defaultVariant, preview);
    }

    /**
     * Returns the default variant.
     */
    public VariantView getVariant() {
        return defaultVariant;
    }

    /**
     * Returns the named variant, or the default variant when {@code name} is null or unknown.
     */
    public VariantView getVariant(String name) {
        if (name != null) {
            for (VariantView variant : variants) {
                if (variant.getName().equals(name)) {
                    return variant;
                }
            }
        }
        return defaultVariant;
    }
}
