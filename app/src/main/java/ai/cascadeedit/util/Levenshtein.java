package ai.cascadeedit.util;

/**
 * Classic unit-cost edit distance, used as a similarity primitive when comparing lines that are
 * expected to be "almost" equal.
 */
public final class Levenshtein {
    private Levenshtein() {
        // utility
    }

    /**
     * Number of single-character insertions, deletions and substitutions needed to turn {@code a} into
     * {@code b}.
     */
    public static int distance(String a, String b) {
        if (a.isEmpty()) {
            return b.length();
        }
        if (b.isEmpty()) {
            return a.length();
        }

        // two rows are enough; row i only depends on row i-1
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            prev[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(prev[j] + 1, curr[j - 1] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }

    /**
     * Similarity ratio in [0, 1]: {@code 1 - distance / max(len(a), len(b), 1)}. Two empty strings are
     * fully similar.
     */
    public static double similarity(String a, String b) {
        int maxLen = Math.max(Math.max(a.length(), b.length()), 1);
        return 1.0 - (double) distance(a, b) / maxLen;
    }
}
