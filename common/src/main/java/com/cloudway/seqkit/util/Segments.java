/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.seqkit.util;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiPredicate;

import com.google.common.collect.Lists;

/**
 * Splits lists into contiguous segments: fixed size chunks, predicate
 * delimited runs and sliding windows.
 *
 * <p>Each returned segment is an independent copy, so modifying a segment
 * never affects the source list or another segment. An empty source list
 * yields an empty list of segments.</p>
 */
public final class Segments
{
    private Segments() {}

    /**
     * Splits the given list into consecutive chunks of {@code size} elements.
     * The last chunk holds the remainder and may be shorter.
     *
     * <pre>{@code
     *     chunked(Arrays.asList(1, 2, 3, 4, 5), 2)  // [[1, 2], [3, 4], [5]]
     * }</pre>
     *
     * @param list the source list
     * @param size the number of elements in each chunk
     * @return the list of chunks
     * @throws IllegalArgumentException if {@code size} is not positive
     */
    public static <T> List<List<T>> chunked(List<? extends T> list, int size) {
        if (size <= 0)
            throw new IllegalArgumentException("chunk size must be positive: " + size);

        int total = list.size();
        List<List<T>> chunks = Lists.newArrayListWithCapacity(ceilDiv(total, size));
        for (int start = 0; start < total; start += size) {
            chunks.add(Slices.copyOf(list, start, Math.min(start + size, total)));
        }
        return chunks;
    }

    /**
     * Splits the given list into runs. The first element opens the first run;
     * each following element is appended to the current run when the
     * predicate accepts the last element of that run followed by the new
     * element, and opens a new run otherwise.
     *
     * <pre>{@code
     *     chunkedBy(Arrays.asList(1, 2, 3, 2, 3, 4), (prev, next) -> next == prev + 1)
     *     // [[1, 2, 3], [2, 3, 4]]
     * }</pre>
     *
     * @param list the source list
     * @param p the predicate deciding whether two neighbours share a run
     * @return the list of runs
     */
    public static <T> List<List<T>> chunkedBy(List<? extends T> list, BiPredicate<? super T, ? super T> p) {
        List<List<T>> runs = new ArrayList<>();
        if (list.isEmpty()) {
            return runs;
        }

        List<T> current = new ArrayList<>();
        T last = null;
        for (T t : list) {
            if (!current.isEmpty() && !p.test(last, t)) {
                runs.add(current);
                current = new ArrayList<>();
            }
            current.add(t);
            last = t;
        }
        runs.add(current);
        return runs;
    }

    /**
     * Returns sliding windows of {@code size} elements advancing by one
     * element at a time.
     *
     * @see #windowed(List, int, int)
     */
    public static <T> List<List<T>> windowed(List<? extends T> list, int size) {
        return windowed(list, size, 1);
    }

    /**
     * Returns windows of at most {@code size} elements, the first starting
     * at index 0 and each next one {@code step} elements further. Windows
     * keep starting at every step position inside the list, so those near
     * the end hold fewer than {@code size} elements.
     *
     * <pre>{@code
     *     windowed(Arrays.asList(1, 2, 3, 4, 5, 6, 7, 8, 9, 10), 5, 3)
     *     // [[1, 2, 3, 4, 5], [4, 5, 6, 7, 8], [7, 8, 9, 10], [10]]
     * }</pre>
     *
     * @param list the source list
     * @param size the maximum number of elements in a window
     * @param step the distance between the starts of two adjacent windows
     * @return the list of windows
     * @throws IllegalArgumentException if {@code size} or {@code step} is not positive
     */
    public static <T> List<List<T>> windowed(List<? extends T> list, int size, int step) {
        if (size <= 0)
            throw new IllegalArgumentException("window size must be positive: " + size);
        if (step <= 0)
            throw new IllegalArgumentException("window step must be positive: " + step);

        int total = list.size();
        List<List<T>> windows = Lists.newArrayListWithCapacity(ceilDiv(total, step));
        int start = 0;
        int end = Math.min(size, total);
        while (start < end) {
            windows.add(Slices.copyOf(list, start, end));
            start = (int)Math.min((long)start + step, total);
            end = (int)Math.min((long)start + size, total);
        }
        return windows;
    }

    static int ceilDiv(int n, int d) {
        return n / d + (n % d == 0 ? 0 : 1);
    }
}
