package com.thicket.db.sdk;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ParamOption {
    String name;
    @Singular
    List<LocalizedText> labels;
}
