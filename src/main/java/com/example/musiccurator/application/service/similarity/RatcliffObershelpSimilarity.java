package com.example.musiccurator.application.service.similarity;

import java.util.ArrayDeque;
import java.util.Deque;
import org.springframework.stereotype.Component;

/**
 * Gestalt pattern matching: twice the number of characters in recursively found longest common
 * blocks, divided by the total length of both strings.
 */
@Component
public class RatcliffObershelpSimilarity implements SimilarityStrategy {

    @Override
    public double similarity(String left, String right) {
        String a = left == null ? "" : left;
        String b = right == null ? "" : right;
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0D;
        }
        return 2.0D * matchingCharacters(a, b) / total;
    }

    int matchingCharacters(String a, String b) {
        int matched = 0;
        Deque<int[]> ranges = new ArrayDeque<>();
        ranges.push(new int[]{0, a.length(), 0, b.length()});
        while (!ranges.isEmpty()) {
            int[] range = ranges.pop();
            int[] block = longestBlock(a, range[0], range[1], b, range[2], range[3]);
            int size = block[2];
            if (size == 0) {
                continue;
            }
            matched += size;
            if (range[0] < block[0] && range[2] < block[1]) {
                ranges.push(new int[]{range[0], block[0], range[2], block[1]});
            }
            if (block[0] + size < range[1] && block[1] + size < range[3]) {
                ranges.push(new int[]{block[0] + size, range[1], block[1] + size, range[3]});
            }
        }
        return matched;
    }

    /**
     * @return {startA, startB, length} of the earliest longest common block in the given ranges
     */
    private int[] longestBlock(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        int bestI = aLo;
        int bestJ = bLo;
        int bestSize = 0;
        int width = bHi - bLo;
        int[] previous = new int[width + 1];
        for (int i = aLo; i < aHi; i++) {
            int[] current = new int[width + 1];
            char ch = a.charAt(i);
            for (int j = bLo; j < bHi; j++) {
                if (b.charAt(j) == ch) {
                    int run = previous[j - bLo] + 1;
                    current[j - bLo + 1] = run;
                    if (run > bestSize) {
                        bestSize = run;
                        bestI = i - run + 1;
                        bestJ = j - run + 1;
                    }
                }
            }
            previous = current;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}
