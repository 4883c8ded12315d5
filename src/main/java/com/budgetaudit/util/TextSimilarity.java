package com.budgetaudit.util;

import java.util.HashSet;
import java.util.Set;

/**
 * Character-bigram similarity. Chinese headings have no word boundaries, so bigrams stand in for tokens.
 */
public final class TextSimilarity {

    private TextSimilarity() {
        // Utility class
    }

    /**
     * Dice coefficient over character bigrams, in [0,1]. Two empty strings are identical.
     */
    public static double dice(String a, String b) {
        Set<String> left = bigrams(a);
        Set<String> right = bigrams(b);
        if (left.isEmpty() && right.isEmpty()) {
            return a == null || b == null ? 0.0 : (a.equals(b) ? 1.0 : 0.0);
        }
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        int shared = 0;
        for (String gram : left) {
            if (right.contains(gram)) {
                shared++;
            }
        }
        return 2.0 * shared / (left.size() + right.size());
    }

    /**
     * Share of the needle's bigrams found in the haystack, in [0,1].
     */
    public static double containment(String needle, String haystack) {
        Set<String> wanted = bigrams(needle);
        if (wanted.isEmpty()) {
            return 0.0;
        }
        Set<String> available = bigrams(haystack);
        int found = 0;
        for (String gram : wanted) {
            if (available.contains(gram)) {
                found++;
            }
        }
        return (double) found / wanted.size();
    }

    static Set<String> bigrams(String text) {
        Set<String> grams = new HashSet<>();
        if (text == null || text.length() < 2) {
            return grams;
        }
        for (int i = 0; i + 2 <= text.length(); i++) {
            grams.add(text.substring(i, i + 2));
        }
        return grams;
    }
}
