package com.clientsync.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Name comparison helpers for record linkage. No I/O.
 */
public final class NameSimilarity {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]");
    private static final Pattern TRAILING_NUMBER = Pattern.compile("\\s+\\d+$");
    private static final Pattern TRAILING_DASH_WORD = Pattern.compile("\\s*[-\u2013\u2014]\\s*\\w+$");
    private static final Pattern TRAILING_BRACKET_WORD = Pattern.compile("\\s*\\(\\s*\\w+\\s*\\)$");

    private static final int SIGNIFICANT_WORD_LENGTH = 3;
    private static final double SUBSTRING_LONG_RATIO = 0.7;
    private static final double SUBSTRING_HIGH_SCORE = 0.95;
    private static final double SUBSTRING_LOW_SCORE = 0.9;

    private NameSimilarity() {
    }

    /**
     * Lowercase and drop everything that is not a letter or digit.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return NON_ALPHANUMERIC.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    /**
     * Similarity on a 0..1 scale.
     *
     * 1.0 for equal normalized names; 0.95 or 0.9 when one contains the other
     * (0.95 if shorter/longer exceeds 0.7); otherwise 1 - editDistance / maxLength.
     */
    public static double similarity(String a, String b) {
        String n1 = normalize(a);
        String n2 = normalize(b);

        if (n1.isEmpty() || n2.isEmpty()) {
            return 0.0;
        }
        if (n1.equals(n2)) {
            return 1.0;
        }

        String shorter = n1.length() <= n2.length() ? n1 : n2;
        String longer = n1.length() <= n2.length() ? n2 : n1;

        if (longer.contains(shorter)) {
            double ratio = (double) shorter.length() / longer.length();
            return ratio > SUBSTRING_LONG_RATIO ? SUBSTRING_HIGH_SCORE : SUBSTRING_LOW_SCORE;
        }

        int distance = editDistance(longer, shorter);
        return 1.0 - (double) distance / longer.length();
    }

    /**
     * Classic Levenshtein distance (insert, delete, substitute all cost 1).
     */
    public static int editDistance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];

        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                        Math.min(current[j - 1] + 1, previous[j] + 1),
                        previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    /**
     * Strip a trailing number, a trailing " - word" or a trailing "(word)".
     * "Hockey Think Tank 123" becomes "Hockey Think Tank".
     */
    public static String baseName(String name) {
        if (name == null) {
            return "";
        }
        String base = TRAILING_NUMBER.matcher(name.trim()).replaceAll("");
        base = TRAILING_DASH_WORD.matcher(base).replaceAll("");
        base = TRAILING_BRACKET_WORD.matcher(base).replaceAll("");
        return base.trim();
    }

    /**
     * Lowercased words of at least three characters, in order, without repeats.
     */
    public static List<String> significantWords(String name) {
        if (name == null) {
            return List.of();
        }
        Set<String> words = new LinkedHashSet<>();
        for (String word : name.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (word.length() >= SIGNIFICANT_WORD_LENGTH) {
                words.add(word);
            }
        }
        return new ArrayList<>(words);
    }
}
