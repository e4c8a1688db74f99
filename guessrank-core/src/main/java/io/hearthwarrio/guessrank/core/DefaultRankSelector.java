package io.hearthwarrio.guessrank.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Partitions indices so the {@code k} best entries come first (quickselect), then sorts only those.
 * <p>
 * Entries are ordered by score, then by input position, so ties keep their input order.
 */
public final class DefaultRankSelector implements RankSelector {

    @Override
    public List<RankedWord> selectBest(List<Word> words, long[] scores, int k) {
        Objects.requireNonNull(words, "words must not be null");
        Objects.requireNonNull(scores, "scores must not be null");
        if (words.size() != scores.length) {
            throw new IllegalArgumentException(
                    "words and scores differ in size: " + words.size() + " vs " + scores.length);
        }
        if (k < 0) {
            throw new IllegalArgumentException("k must not be negative: " + k);
        }

        int n = scores.length;
        int count = Math.min(k, n);
        if (count == 0) {
            return List.of();
        }

        int[] indices = new int[n];
        for (int i = 0; i < n; i++) {
            indices[i] = i;
        }

        if (count < n) {
            select(indices, scores, count);
        }
        sort(indices, scores, 0, count - 1);

        List<RankedWord> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int idx = indices[i];
            out.add(new RankedWord(words.get(idx), scores[idx]));
        }
        return out;
    }

    /**
     * Rearranges indices so the {@code count} smallest entries occupy {@code [0, count)}.
     */
    private static void select(int[] indices, long[] scores, int count) {
        int lo = 0;
        int hi = indices.length - 1;
        int nth = count - 1;
        while (lo < hi) {
            int p = partition(indices, scores, lo, hi);
            if (p == nth) {
                return;
            }
            if (p < nth) {
                lo = p + 1;
            } else {
                hi = p - 1;
            }
        }
    }

    private static void sort(int[] indices, long[] scores, int lo, int hi) {
        while (lo < hi) {
            int p = partition(indices, scores, lo, hi);
            // recurse into the smaller half
            if (p - lo < hi - p) {
                sort(indices, scores, lo, p - 1);
                lo = p + 1;
            } else {
                sort(indices, scores, p + 1, hi);
                hi = p - 1;
            }
        }
    }

    /**
     * Lomuto partition around the median of three. Returns the final pivot position.
     */
    private static int partition(int[] indices, long[] scores, int lo, int hi) {
        int mid = (lo + hi) >>> 1;
        if (less(indices[mid], indices[lo], scores)) {
            swap(indices, mid, lo);
        }
        if (less(indices[hi], indices[lo], scores)) {
            swap(indices, hi, lo);
        }
        if (less(indices[mid], indices[hi], scores)) {
            swap(indices, mid, hi);
        }

        int pivot = indices[hi];
        int store = lo;
        for (int i = lo; i < hi; i++) {
            if (less(indices[i], pivot, scores)) {
                swap(indices, i, store);
                store++;
            }
        }
        swap(indices, store, hi);
        return store;
    }

    private static boolean less(int a, int b, long[] scores) {
        int c = Long.compare(scores[a], scores[b]);
        return c < 0 || (c == 0 && a < b);
    }

    private static void swap(int[] a, int i, int j) {
        int t = a[i];
        a[i] = a[j];
        a[j] = t;
    }
}
