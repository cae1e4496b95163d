package com.phillippitts.huevoice.service.dispatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Token-set similarity on a 0-100 scale.
 *
 * <p>Both strings are reduced to sorted sets of alphanumeric tokens. The score is the best
 * character similarity among the shared tokens alone, shared plus the rest of the first string,
 * and shared plus the rest of the second. A query that contains every token of a phrase, in any
 * order and with extra words around it, therefore scores 100.
 *
 * <p>Character similarity is {@code 200 * LCS / (len(a) + len(b))}, where LCS is the longest
 * common subsequence.
 */
public final class FuzzyMatcher {

    private FuzzyMatcher() {
        // Utility class
    }

    /**
     * @return similarity in [0, 100]; 0 when either side has no tokens
     */
    public static int tokenSetScore(String query, String phrase) {
        return tokenSetScore(query, phrase, Set.of());
    }

    /**
     * Same as {@link #tokenSetScore(String, String)} with {@code ignored} tokens dropped from both
     * sides first.
     */
    public static int tokenSetScore(String query, String phrase, Set<String> ignored) {
        TreeSet<String> a = new TreeSet<>(tokenize(query));
        TreeSet<String> b = new TreeSet<>(tokenize(phrase));
        a.removeAll(ignored);
        b.removeAll(ignored);
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }

        TreeSet<String> shared = new TreeSet<>(a);
        shared.retainAll(b);
        TreeSet<String> onlyA = new TreeSet<>(a);
        onlyA.removeAll(shared);
        TreeSet<String> onlyB = new TreeSet<>(b);
        onlyB.removeAll(shared);

        String sect = String.join(" ", shared);
        String combinedA = join(sect, String.join(" ", onlyA));
        String combinedB = join(sect, String.join(" ", onlyB));

        int best = ratio(combinedA, combinedB);
        if (!sect.isEmpty()) {
            best = Math.max(best, ratio(sect, combinedA));
            best = Math.max(best, ratio(sect, combinedB));
        }
        return best;
    }

    /**
     * Character similarity {@code 200 * LCS / (len(a) + len(b))}, rounded.
     */
    static int ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 100;
        }
        return (int) Math.round(200.0 * longestCommonSubsequence(a, b) / total);
    }

    static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String part : text.toLowerCase(Locale.ROOT).split("[^\\p{Alnum}]+")) {
            if (!part.isBlank()) {
                tokens.add(part);
            }
        }
        return List.copyOf(tokens);
    }

    private static int longestCommonSubsequence(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                if (a.charAt(i - 1) == b.charAt(j - 1)) {
                    curr[j] = prev[j - 1] + 1;
                } else {
                    curr[j] = Math.max(prev[j], curr[j - 1]);
                }
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }

    private static String join(String head, String tail) {
        if (head.isEmpty()) {
            return tail;
        }
        return tail.isEmpty() ? head : head + " " + tail;
    }
}
