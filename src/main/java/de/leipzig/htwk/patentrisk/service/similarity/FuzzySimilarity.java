package de.leipzig.htwk.patentrisk.service.similarity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Token-set edit similarity on [0,1].
 * <p>
 * Both texts are lowercased and reduced to alphanumeric tokens. The shared tokens and the
 * two sorted remainders are compared pairwise with a normalized insert/delete distance and
 * the best ratio wins, so word order and repeated words do not matter, and one text being
 * a token subset of the other scores 1.
 */
public final class FuzzySimilarity {

    private FuzzySimilarity() {
    }

    public static double similarity(String a, String b) {
        Set<String> tokensA = tokenize(a);
        Set<String> tokensB = tokenize(b);
        if (tokensA.isEmpty() || tokensB.isEmpty()) {
            return 0.0;
        }

        TreeSet<String> intersection = new TreeSet<>(tokensA);
        intersection.retainAll(tokensB);
        TreeSet<String> onlyA = new TreeSet<>(tokensA);
        onlyA.removeAll(tokensB);
        TreeSet<String> onlyB = new TreeSet<>(tokensB);
        onlyB.removeAll(tokensA);

        if (!intersection.isEmpty() && (onlyA.isEmpty() || onlyB.isEmpty())) {
            return 1.0;
        }

        String sect = String.join(" ", intersection);
        String diffA = String.join(" ", onlyA);
        String diffB = String.join(" ", onlyB);

        double best = ratio(diffA, diffB);
        if (sect.isEmpty()) {
            return best;
        }

        // sect is a prefix of "sect diff", so the distance is just the appended part
        int sectLen = sect.length();
        double sectA = 1.0 - (double) (1 + diffA.length()) / (2 * sectLen + 1 + diffA.length());
        double sectB = 1.0 - (double) (1 + diffB.length()) / (2 * sectLen + 1 + diffB.length());

        return Math.max(best, Math.max(sectA, sectB));
    }

    /**
     * Normalized insert/delete similarity of two strings
     */
    static double ratio(String s1, String s2) {
        int total = s1.length() + s2.length();
        if (total == 0) {
            return 1.0;
        }
        int lcs = longestCommonSubsequence(s1, s2);
        int distance = total - 2 * lcs;
        return 1.0 - (double) distance / total;
    }

    private static int longestCommonSubsequence(String s1, String s2) {
        int[] previous = new int[s2.length() + 1];
        int[] current = new int[s2.length() + 1];

        for (int i = 1; i <= s1.length(); i++) {
            char c = s1.charAt(i - 1);
            for (int j = 1; j <= s2.length(); j++) {
                if (c == s2.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[s2.length()];
    }

    static Set<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        String normalized = text.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]+", " ").trim();
        if (normalized.isEmpty()) {
            return Set.of();
        }
        List<String> tokens = new ArrayList<>(Arrays.asList(normalized.split(" ")));
        tokens.removeIf(String::isEmpty);
        return new LinkedHashSet<>(tokens);
    }
}
