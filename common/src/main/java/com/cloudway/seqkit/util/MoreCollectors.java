/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.seqkit.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.stream.Collector;

import com.cloudway.seqkit.data.Tuple;

/**
 * Implementations of {@link Collector} that feed stream elements to the
 * segmentation and grouping operations of this package.
 *
 * <p>The following are examples of using the predefined collectors:
 *
 * <pre>{@code
 *     // Split ids into batches of 100
 *     List<List<Long>> batches = ids.stream().collect(MoreCollectors.toChunks(100));
 *
 *     // Moving windows of three readings
 *     List<List<Double>> windows = readings.stream().collect(MoreCollectors.toWindows(3, 1));
 * }</pre>
 *
 * <p>Collectors defined here buffer the stream elements in encounter order
 * and segment them once the stream is exhausted, so they produce the same
 * result as the corresponding list operation on the collected elements,
 * for sequential and parallel streams alike. Arguments are validated when
 * the collector is created.</p>
 */
public final class MoreCollectors
{
    private MoreCollectors() {}

    /**
     * Returns a {@code Collector} that splits the input elements into chunks
     * of the given size.
     *
     * @param <T> the type of the input elements
     * @param size the number of elements in each chunk
     * @return a {@code Collector} producing the list of chunks
     * @throws IllegalArgumentException if {@code size} is not positive
     * @see Segments#chunked(List, int)
     */
    public static <T> Collector<T, ?, List<List<T>>> toChunks(int size) {
        if (size <= 0)
            throw new IllegalArgumentException("chunk size must be positive: " + size);
        return buffering(list -> Segments.chunked(list, size));
    }

    /**
     * Returns a {@code Collector} that splits the input elements into runs
     * of neighbours accepted by the given predicate.
     *
     * @param <T> the type of the input elements
     * @param p the predicate deciding whether two neighbours share a run
     * @return a {@code Collector} producing the list of runs
     * @see Segments#chunkedBy(List, BiPredicate)
     */
    public static <T> Collector<T, ?, List<List<T>>> toRuns(BiPredicate<? super T, ? super T> p) {
        return buffering(list -> Segments.chunkedBy(list, p));
    }

    /**
     * Returns a {@code Collector} that produces windows of the input
     * elements.
     *
     * @param <T> the type of the input elements
     * @param size the maximum number of elements in a window
     * @param step the distance between the starts of two adjacent windows
     * @return a {@code Collector} producing the list of windows
     * @throws IllegalArgumentException if {@code size} or {@code step} is not positive
     * @see Segments#windowed(List, int, int)
     */
    public static <T> Collector<T, ?, List<List<T>>> toWindows(int size, int step) {
        if (size <= 0)
            throw new IllegalArgumentException("window size must be positive: " + size);
        if (step <= 0)
            throw new IllegalArgumentException("window step must be positive: " + step);
        return buffering(list -> Segments.windowed(list, size, step));
    }

    /**
     * Returns a {@code Collector} that keeps the first input element for
     * each key computed by the given selector.
     *
     * @see Partitions#distinctBy(List, Function)
     */
    public static <T, K> Collector<T, ?, List<T>> toDistinctBy(Function<? super T, ? extends K> selector) {
        return buffering(list -> Partitions.distinctBy(list, selector));
    }

    /**
     * Returns a {@code Collector} implementing a "group by" operation where
     * the transform produces both the key and the grouped value of each
     * element.
     *
     * @see Partitions#groupBy(List, Function)
     */
    public static <T, K, V> Collector<T, ?, Map<K, List<V>>>
    toGroups(Function<? super T, ? extends Tuple<? extends K, ? extends V>> transform) {
        return buffering(list -> Partitions.<T, K, V>groupBy(list, transform));
    }

    private static <T, R> Collector<T, ?, R> buffering(Function<List<T>, R> finisher) {
        return Collector.of(ArrayList<T>::new, ArrayList::add,
                            (l, r) -> { l.addAll(r); return l; },
                            finisher::apply);
    }
}
