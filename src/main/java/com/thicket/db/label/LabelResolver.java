package com.thicket.db.label;

import java.util.Map;

/**
 * Resolves display labels for model, variant and season names.
 *
 * Lookup order for a locale such as {@code en_GB}: the normalized tag {@code en-GB},
 * then its primary subtag {@code en}, then the key itself. A key without labels is
 * its own label.
 */
public class LabelResolver {

    private final Map<String, Map<String, String>> labels;
    private final String defaultLocale;

    public LabelResolver(Map<String, Map<String, String>> labels, String defaultLocale) {
        this.labels = labels == null ? Map.of() : labels;
        this.defaultLocale = normalizeLocale(defaultLocale);
    }

    public String resolve(String key) {
        return resolve(key, null);
    }

    public String resolve(String key, String locale) {
        if (key == null) {
            return "";
        }
        Map<String, String> byLocale = labels.get(key);
        if (byLocale == null || byLocale.isEmpty()) {
            return key;
        }
        String tag = locale == null ? defaultLocale : normalizeLocale(locale);
        if (tag == null) {
            return key;
        }
        String exact = byLocale.get(tag);
        if (isPresent(exact)) {
            return exact;
        }
        String primary = byLocale.get(primarySubtag(tag));
        if (isPresent(primary)) {
            return primary;
        }
        return key;
    }

    /**
     * Replaces underscores with hyphens, so {@code de_DE} and {@code de-DE} are the same tag.
     */
    public static String normalizeLocale(String locale) {
        return locale == null ? null : locale.replace('_', '-');
    }

    /**
     * The part of the tag before the first hyphen, or the whole tag.
     */
    public static String primarySubtag(String tag) {
        int hyphen = tag.indexOf('-');
        return hyphen < 0 ? tag : tag.substring(0, hyphen);
    }

    private static boolean isPresent(String label) {
        return label != null && !label.isEmpty();
    }
}
