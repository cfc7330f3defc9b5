package com.thicket.db.view;

import com.thicket.db.label.LabelResolver;
import lombok.Value;

/**
 * A season of a variant with its resolved label.
 */
@Value
public class SeasonView {
    String name;
    String label;

    public static SeasonView of(String name, LabelResolver resolver) {
        return new SeasonView(name, resolver.resolve(name));
    }
}
