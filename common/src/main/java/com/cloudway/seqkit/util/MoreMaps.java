/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.seqkit.util;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import com.cloudway.seqkit.data.Tuple;
import com.cloudway.seqkit.function.TriFunction;

/**
 * Static utility methods over caller-owned maps.
 *
 * @see com.cloudway.seqkit.data.MemoTable
 */
public final class MoreMaps
{
    private MoreMaps() {}

    /**
     * Returns the value mapped to the given key. If the map has no mapping
     * for the key the supplier is invoked once and its result is stored in
     * the map and returned. A key explicitly mapped to {@code null} counts as
     * present.
     *
     * @param map the map to look up and update
     * @param key the key whose value is requested
     * @param compute the function producing the value for an absent key
     * @return the existing or newly stored value
     */
    public static <K, V> V getOrPut(Map<K, V> map, K key, Supplier<? extends V> compute) {
        return getOrInsert(map, key, k -> compute.get());
    }

    /**
     * Same as {@link #getOrPut} except the compute function receives the
     * missing key. A value stored for the key by the compute function itself
     * is kept and returned.
     */
    public static <K, V> V getOrInsert(Map<K, V> map, K key, Function<? super K, ? extends V> compute) {
        V value = map.get(key);
        if (value != null || map.containsKey(key)) {
            return value;
        }

        value = compute.apply(key);
        if (map.containsKey(key)) {
            return map.get(key);
        }
        map.put(key, value);
        return value;
    }

    /**
     * Returns the entries of the given map as a list of tuples, in the map's
     * iteration order.
     */
    public static <K, V> List<Tuple<K, V>> entries(Map<? extends K, ? extends V> map) {
        List<Tuple<K, V>> result = Lists.newArrayListWithCapacity(map.size());
        map.forEach((k, v) -> result.add(Tuple.of(k, v)));
        return result;
    }

    /**
     * Accumulates value starting with the initial value and applying the
     * given function to the accumulator and each key and value, in the map's
     * iteration order.
     */
    public static <K, V, R> R foldEntries(Map<? extends K, ? extends V> map, R initial,
                                          TriFunction<R, ? super K, ? super V, R> f) {
        R acc = initial;
        for (Map.Entry<? extends K, ? extends V> e : map.entrySet()) {
            acc = f.apply(acc, e.getKey(), e.getValue());
        }
        return acc;
    }

    /**
     * Builds a new map by transforming every entry of the given map. The
     * function returns the new key and value, or an empty {@code Optional}
     * to drop the entry. When two entries transform to the same key the
     * later one in iteration order wins.
     *
     * @param map the source map
     * @param f the entry transformation
     * @return a new map in the iteration order of the transformed entries
     */
    public static <K, V, K2, V2> Map<K2, V2>
    transformEntries(Map<? extends K, ? extends V> map,
                     BiFunction<? super K, ? super V, ? extends Optional<? extends Tuple<? extends K2, ? extends V2>>> f) {
        Map<K2, V2> result = Maps.newLinkedHashMap();
        map.forEach((k, v) -> f.apply(k, v).ifPresent(t -> result.put(t.first(), t.second())));
        return result;
    }
}
