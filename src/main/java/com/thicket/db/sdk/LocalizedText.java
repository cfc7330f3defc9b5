package com.thicket.db.sdk;

import lombok.Value;

/**
 * A display string in one locale, as reported by the extractor.
 */
@Value
public class LocalizedText {
    String lang;
    String text;
}
