/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.seqkit.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Predicate;

import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;

import com.cloudway.seqkit.function.IndexedBiFunction;
import com.cloudway.seqkit.function.IndexedFunction;
import com.cloudway.seqkit.function.IndexedPredicate;

/**
 * Element-wise transformations and left folds over lists.
 *
 * <p>Every operation makes a single left-to-right pass over its input and
 * invokes the given callback in element order. Inputs are never modified;
 * list results are newly allocated and belong to the caller. An empty input
 * yields an empty list, never {@code null}.</p>
 */
public final class Transforms
{
    private Transforms() {}

    /**
     * Returns a list containing the results of applying the given function
     * to each element of the given list.
     *
     * @param list the source list
     * @param f the function to apply to each element
     * @return the mapped list
     */
    public static <T, R> List<R> map(List<? extends T> list, Function<? super T, ? extends R> f) {
        List<R> result = Lists.newArrayListWithCapacity(list.size());
        for (T t : list) {
            result.add(f.apply(t));
        }
        return result;
    }

    /**
     * Returns a list containing the results of applying the given function
     * to each element and its index.
     *
     * @param list the source list
     * @param f the function to apply to each index and element
     * @return the mapped list
     */
    public static <T, R> List<R> mapIndexed(List<? extends T> list, IndexedFunction<? super T, ? extends R> f) {
        List<R> result = Lists.newArrayListWithCapacity(list.size());
        int i = 0;
        for (T t : list) {
            result.add(f.apply(i++, t));
        }
        return result;
    }

    /**
     * Returns a list containing only elements matching the given predicate.
     *
     * @param list the source list
     * @param p the predicate to test elements
     * @return the filtered list
     */
    public static <T> List<T> filter(List<? extends T> list, Predicate<? super T> p) {
        List<T> result = new ArrayList<>();
        for (T t : list) {
            if (p.test(t)) {
                result.add(t);
            }
        }
        return result;
    }

    /**
     * Returns a list containing only elements matching the given predicate.
     * The predicate receives the index of each element as well.
     *
     * @param list the source list
     * @param p the predicate to test elements
     * @return the filtered list
     */
    public static <T> List<T> filterIndexed(List<? extends T> list, IndexedPredicate<? super T> p) {
        List<T> result = new ArrayList<>();
        int i = 0;
        for (T t : list) {
            if (p.test(i++, t)) {
                result.add(t);
            }
        }
        return result;
    }

    /**
     * Filters and maps the given list in one pass. The function returns the
     * mapped value for elements to keep and an empty {@code Optional} for
     * elements to drop.
     *
     * @param list the source list
     * @param f the mapping function
     * @return the list of mapped values that were kept
     */
    public static <T, R> List<R> filterMap(List<? extends T> list, Function<? super T, ? extends Optional<? extends R>> f) {
        List<R> result = new ArrayList<>();
        for (T t : list) {
            Optional<? extends R> r = f.apply(t);
            if (r.isPresent()) {
                result.add(r.get());
            }
        }
        return result;
    }

    /**
     * Applies the given function to each element and concatenates the
     * returned sequences into a single list.
     *
     * @param list the source list
     * @param f the function producing a sequence for each element
     * @return the flattened list
     */
    public static <T, R> List<R> flatMap(List<? extends T> list, Function<? super T, ? extends Iterable<? extends R>> f) {
        List<R> result = new ArrayList<>();
        for (T t : list) {
            Iterables.addAll(result, f.apply(t));
        }
        return result;
    }

    /**
     * Same as {@link #flatMap} except the function receives the index of
     * each element.
     */
    public static <T, R> List<R> flatMapIndexed(List<? extends T> list,
                                                IndexedFunction<? super T, ? extends Iterable<? extends R>> f) {
        List<R> result = Lists.newArrayListWithCapacity(list.size());
        int i = 0;
        for (T t : list) {
            Iterables.addAll(result, f.apply(i++, t));
        }
        return result;
    }

    /**
     * Accumulates value starting with the initial value and applying the
     * given function from left to right to the current accumulator and each
     * element. Returns the initial value for an empty list.
     *
     * @param list the source list
     * @param initial the initial accumulator value
     * @param f the accumulating function
     * @return the accumulated value
     */
    public static <T, R> R fold(List<? extends T> list, R initial, BiFunction<R, ? super T, R> f) {
        R acc = initial;
        for (T t : list) {
            acc = f.apply(acc, t);
        }
        return acc;
    }

    /**
     * Same as {@link #fold} except the function receives the index of each
     * element.
     */
    public static <T, R> R foldIndexed(List<? extends T> list, R initial, IndexedBiFunction<R, ? super T> f) {
        R acc = initial;
        int i = 0;
        for (T t : list) {
            acc = f.apply(i++, acc, t);
        }
        return acc;
    }

    /**
     * Accumulates value starting with the first element and applying the
     * given operator from left to right to the current accumulator and each
     * following element. A single element list returns that element without
     * invoking the operator.
     *
     * @param list the source list
     * @param f the combining operator
     * @return the accumulated value
     * @throws NoSuchElementException if the list is empty
     */
    public static <T> T reduce(List<? extends T> list, BinaryOperator<T> f) {
        Iterator<? extends T> it = list.iterator();
        if (!it.hasNext()) {
            throw new NoSuchElementException("reduce called on an empty list");
        }

        T acc = it.next();
        while (it.hasNext()) {
            acc = f.apply(acc, it.next());
        }
        return acc;
    }

    /**
     * Same as {@link #reduce} except the operator receives the index of the
     * element being combined, starting from 1 for the second element.
     *
     * @throws NoSuchElementException if the list is empty
     */
    public static <T> T reduceIndexed(List<? extends T> list, IndexedBiFunction<T, ? super T> f) {
        Iterator<? extends T> it = list.iterator();
        if (!it.hasNext()) {
            throw new NoSuchElementException("reduceIndexed called on an empty list");
        }

        T acc = it.next();
        for (int i = 1; it.hasNext(); i++) {
            acc = f.apply(i, acc, it.next());
        }
        return acc;
    }
}
