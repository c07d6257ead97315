package com.raditha.repairgraph.metrics;

import java.util.List;

/**
 * Levenshtein edit distance over token sequences.
 * Space-optimized dynamic programming implementation.
 */
public class TokenEditDistance {

    /**
     * Compute the number of token insertions, deletions and substitutions turning one sequence
     * into the other, using only O(min(m,n)) space.
     */
    public int distance(List<String> tokens1, List<String> tokens2) {
        List<String> shorter = tokens1.size() <= tokens2.size() ? tokens1 : tokens2;
        List<String> longer = shorter == tokens1 ? tokens2 : tokens1;
        int m = shorter.size();
        int n = longer.size();

        // Rolling rows: only the previous and current row are needed
        int[] prev = new int[m + 1];
        int[] curr = new int[m + 1];
        for (int i = 0; i <= m; i++) {
            prev[i] = i;
        }

        for (int j = 1; j <= n; j++) {
            curr[0] = j;
            for (int i = 1; i <= m; i++) {
                if (shorter.get(i - 1).equals(longer.get(j - 1))) {
                    curr[i] = prev[i - 1];
                } else {
                    curr[i] = 1 + Math.min(Math.min(prev[i], curr[i - 1]), prev[i - 1]);
                }
            }
            int[] temp = prev;
            prev = curr;
            curr = temp;
        }
        return prev[m];
    }

    /**
     * Similarity score derived from the distance: 1 - distance / longer length.
     *
     * @return a value between 0.0 and 1.0, 1.0 for two empty sequences
     */
    public double similarity(List<String> tokens1, List<String> tokens2) {
        if (tokens1.isEmpty() && tokens2.isEmpty()) {
            return 1.0;
        }
        int maxLength = Math.max(tokens1.size(), tokens2.size());
        return 1.0 - ((double) distance(tokens1, tokens2) / maxLength);
    }
}
