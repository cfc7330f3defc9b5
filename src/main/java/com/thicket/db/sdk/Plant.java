package com.thicket.db.sdk;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Raw metadata of one asset as returned by {@link PlantSdk#load}. Labels may contain
 * several strings for the same locale.
 */
@Value
@Builder
public class Plant {
    public static final String VARIANT_PARAM = "variant";
    public static final String SEASON_PARAM = "season";

    String name;
    @Singular
    List<LocalizedText> labels;
    @Singular
    List<PlantParam> params;
    /** Variant names in the order the asset declares them. */
    @Singular
    List<String> variants;

    public Optional<PlantParam> findParam(String paramName) {
        return params.stream().filter(p -> p.getName().equals(paramName)).findFirst();
    }
}
