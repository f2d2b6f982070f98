package com.ocreval.core.metric;

/**
 * 基于 Unicode 码点的 Levenshtein 编辑距离（插入、删除、替换代价均为 1）。
 */
public final class LevenshteinDistance {

    private LevenshteinDistance() {
    }

    public static int distance(String left, String right) {
        int[] a = left.codePoints().toArray();
        int[] b = right.codePoints().toArray();
        if (a.length < b.length) {
            int[] swap = a;
            a = b;
            b = swap;
        }
        if (b.length == 0) {
            return a.length;
        }

        // 两行滚动数组
        int[] previous = new int[b.length + 1];
        int[] current = new int[b.length + 1];
        for (int j = 0; j <= b.length; j++) {
            previous[j] = j;
        }
        for (int i = 0; i < a.length; i++) {
            current[0] = i + 1;
            for (int j = 0; j < b.length; j++) {
                int substitution = previous[j] + (a[i] == b[j] ? 0 : 1);
                int insertion = previous[j + 1] + 1;
                int deletion = current[j] + 1;
                current[j + 1] = Math.min(substitution, Math.min(insertion, deletion));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length];
    }

    public static int length(String text) {
        return text.codePointCount(0, text.length());
    }
}
