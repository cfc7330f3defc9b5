package com.thicket.db.view;

import com.thicket.db.label.LabelResolver;
import com.thicket.db.model.VariantRecord;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only projection of a {@link VariantRecord}. Seasons keep the order the asset
 * declares them in.
 */
@Value
public class VariantView {
    String name;
    String label;
    int index;
    List<SeasonView> seasons;
    SeasonView defaultSeason;
    String preview;

    public static VariantView of(String name, VariantRecord record, String modelPreview, LabelResolver resolver) {
        List<SeasonView> seasons = new ArrayList<>();
        if (record.getSeasons() != null) {
            for (String season : record.getSeasons()) {
                seasons.add(SeasonView.of(season, resolver));
            }
        }

        SeasonView defaultSeason = null;
        if (record.getDefaultSeason() != null) {
            defaultSeason = SeasonView.of(record.getDefaultSeason(), resolver);
        } else if (!seasons.isEmpty()) {
            defaultSeason = seasons.get(0);
        }

        String preview = record.getPreview();
        if (preview == null || preview.isEmpty()) {
            preview = modelPreview == null ? "" : modelPreview;
        }

        return new VariantView(name, resolver.resolve(name), record.getIndex(),
                Collections.unmodifiableList(seasons), defaultSeason, preview);
    }

    /**
     * Returns the default season.
     */
    public SeasonView getSeason() {
        return defaultSeason;
    }

    /**
     * Returns the named season, or the default season when {@code name} is null or unknown.
     */
    public SeasonView getSeason(String name) {
        if (name != null) {
            for (SeasonView season : seasons) {
                if (season.getName().equals(name)) {
                    return season;
                }
            }
        }
        return defaultSeason;
    }
}
