package com.clientsync.util;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Slug generation for client rows.
 */
public final class SlugUtil {

    private static final Pattern DISALLOWED = Pattern.compile("[^a-z0-9\\s-]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern REPEATED_HYPHENS = Pattern.compile("-+");
    private static final Pattern EDGE_HYPHENS = Pattern.compile("^-|-$");
    private static final Pattern NUMERIC_SUFFIX = Pattern.compile("-\\d+$");

    private static final int MAX_SLUG_LENGTH = 100;

    private SlugUtil() {
    }

    /**
     * "Hockey Think Tank!" becomes "hockey-think-tank". May return an empty string.
     */
    public static String slugify(String name) {
        if (name == null) {
            return "";
        }
        String slug = DISALLOWED.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("");
        slug = WHITESPACE.matcher(slug.trim()).replaceAll("-");
        slug = REPEATED_HYPHENS.matcher(slug).replaceAll("-");
        slug = EDGE_HYPHENS.matcher(slug).replaceAll("");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = EDGE_HYPHENS.matcher(slug.substring(0, MAX_SLUG_LENGTH)).replaceAll("");
        }
        return slug;
    }

    /**
     * "acme-corp-2" becomes "acme-corp"; slugs without a numeric suffix are returned unchanged.
     */
    public static String stripNumericSuffix(String slug) {
        if (slug == null) {
            return "";
        }
        String stripped = NUMERIC_SUFFIX.matcher(slug).replaceAll("");
        return stripped.isEmpty() ? slug : stripped;
    }

    /**
     * True when the two slugs are equal or differ only by a numeric suffix on one side.
     */
    public static boolean sameBaseSlug(String candidate, String existing) {
        if (candidate == null || existing == null) {
            return false;
        }
        return candidate.equals(existing)
                || stripNumericSuffix(candidate).equals(existing)
                || stripNumericSuffix(existing).equals(candidate);
    }

    /**
     * First of {@code slug}, {@code slug-2}, {@code slug-3}, ... that is not taken.
     */
    public static String firstAvailable(String slug, Set<String> taken) {
        if (!taken.contains(slug)) {
            return slug;
        }
        int suffix = 2;
        while (taken.contains(slug + "-" + suffix)) {
            suffix++;
        }
        return slug + "-" + suffix;
    }
}
