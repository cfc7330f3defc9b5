package com.thicket.db.sdk;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * An enumerated plant parameter such as {@code variant} or {@code season}.
 */
@Value
@Builder
public class PlantParam {
    String name;
    int defaultIndex;
    @Singular
    List<ParamOption> options;

    public Optional<ParamOption> defaultOption() {
        if (defaultIndex < 0 || defaultIndex >= options.size()) {
            return Optional.empty();
        }
        return Optional.of(options.get(defaultIndex));
    }

    public Optional<ParamOption> findOption(String optionName) {
        return options.stream().filter(o -> o.getName().equals(optionName)).findFirst();
    }
}
