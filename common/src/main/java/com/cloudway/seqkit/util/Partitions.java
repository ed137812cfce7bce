/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.seqkit.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import com.cloudway.seqkit.data.Pair;
import com.cloudway.seqkit.data.Tuple;

/**
 * Quantifiers, partitioning, de-duplication and grouping of list elements.
 *
 * <p>Operations that rely on element or key identity use {@code equals} and
 * {@code hashCode} of the element or key type. Relative element order is
 * preserved in every result.</p>
 */
public final class Partitions
{
    private Partitions() {}

    /**
     * Returns {@code true} if all elements match the given predicate,
     * including the vacuous case of an empty list.
     */
    public static <T> boolean all(List<? extends T> list, Predicate<? super T> p) {
        for (T t : list) {
            if (!p.test(t)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns {@code true} if at least one element matches the given
     * predicate. An empty list has no matching element.
     */
    public static <T> boolean any(List<? extends T> list, Predicate<? super T> p) {
        for (T t : list) {
            if (p.test(t)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Splits the given list in two. The first list of the returned pair holds
     * the elements matching the predicate, the second list holds the rest.
     *
     * @param list the source list
     * @param p the predicate to test elements
     * @return a pair of matching and non-matching elements
     */
    public static <T> Pair<List<T>> partition(List<? extends T> list, Predicate<? super T> p) {
        List<T> matching = new ArrayList<>();
        List<T> rest = new ArrayList<>();
        for (T t : list) {
            (p.test(t) ? matching : rest).add(t);
        }
        return new Pair<>(matching, rest);
    }

    /**
     * Returns the elements of the given list with duplicates removed, in
     * order of their first occurrence.
     */
    public static <T> List<T> distinct(List<? extends T> list) {
        return distinctBy(list, Function.identity());
    }

    /**
     * Returns the elements whose key, as computed by the given selector, was
     * not seen earlier in the list. The first element for each key wins.
     *
     * @param list the source list
     * @param selector the function computing the identity key of an element
     * @return the de-duplicated list
     */
    public static <T, K> List<T> distinctBy(List<? extends T> list, Function<? super T, ? extends K> selector) {
        Set<K> seen = Sets.newHashSetWithExpectedSize(list.size());
        List<T> result = new ArrayList<>();
        for (T t : list) {
            if (seen.add(selector.apply(t))) {
                result.add(t);
            }
        }
        return result;
    }

    /**
     * Groups values by keys. The transform maps each element to a key and a
     * value; the value lists in the result preserve the order of the elements
     * they came from, and keys appear in order of first occurrence. Only keys
     * produced by some element appear in the result.
     *
     * <pre>{@code
     *     groupBy(Arrays.asList("apple", "apricot", "banana"), s -> Tuple.of(s.charAt(0), s))
     *     // {a=[apple, apricot], b=[banana]}
     * }</pre>
     *
     * @param list the source list
     * @param transform the function producing a key and a value from each element
     * @return the map from keys to grouped values
     */
    public static <T, K, V> Map<K, List<V>>
    groupBy(List<? extends T> list, Function<? super T, ? extends Tuple<? extends K, ? extends V>> transform) {
        Map<K, List<V>> groups = Maps.newLinkedHashMap();
        for (T t : list) {
            Tuple<? extends K, ? extends V> kv = transform.apply(t);
            groups.computeIfAbsent(kv.first(), k -> new ArrayList<>()).add(kv.second());
        }
        return groups;
    }

    /**
     * Groups the elements themselves by the key computed by the given
     * classifier.
     */
    public static <T, K> Map<K, List<T>>
    groupingBy(List<? extends T> list, Function<? super T, ? extends K> classifier) {
        Map<K, List<T>> groups = Maps.newLinkedHashMap();
        for (T t : list) {
            groups.computeIfAbsent(classifier.apply(t), k -> Lists.newArrayListWithCapacity(4)).add(t);
        }
        return groups;
    }
}
