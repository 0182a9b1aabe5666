package com.raditha.mdr.similarity;

/**
 * Edit-distance ratio between two strings.
 * Insertions and deletions cost 1 and substitutions cost 2, so the ratio is
 * {@code (|a| + |b| - distance) / (|a| + |b|)}.
 * Space-optimized dynamic programming implementation.
 */
public class LevenshteinRatio implements StringSimilarity {

    @Override
    public double ratio(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }

        int lengthSum = a.length() + b.length();
        if (lengthSum == 0) {
            return 1.0;
        }

        int distance = computeEditDistance(a, b);
        return (double) (lengthSum - distance) / lengthSum;
    }

    /**
     * Compute the weighted edit distance using two rolling rows.
     * Uses only O(min(m,n)) space instead of O(m*n).
     */
    int computeEditDistance(String a, String b) {
        // Ensure a is the shorter string for space optimization
        if (a.length() > b.length()) {
            String temp = a;
            a = b;
            b = temp;
        }

        int m = a.length();
        int n = b.length();

        int[] prev = new int[m + 1];
        int[] curr = new int[m + 1];

        for (int i = 0; i <= m; i++) {
            prev[i] = i;
        }

        for (int j = 1; j <= n; j++) {
            curr[0] = j;
            char cb = b.charAt(j - 1);

            for (int i = 1; i <= m; i++) {
                if (a.charAt(i - 1) == cb) {
                    curr[i] = prev[i - 1];
                } else {
                    // Min of: delete, insert, replace (replace counts twice)
                    curr[i] = Math.min(
                            Math.min(prev[i], curr[i - 1]) + 1,
                            prev[i - 1] + 2);
                }
            }

            int[] temp = prev;
            prev = curr;
            curr = temp;
        }

        return prev[m];
    }
}
