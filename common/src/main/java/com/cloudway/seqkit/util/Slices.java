/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.seqkit.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ListIterator;
import java.util.function.Predicate;

import com.google.common.collect.Lists;

/**
 * Prefix, suffix and ordering operations on lists.
 *
 * <p>All operations except {@link #reverse(List)} leave the input untouched
 * and return a new list. Counts below zero are treated as zero and counts
 * beyond the list length are clamped to the length.</p>
 */
public final class Slices
{
    private Slices() {}

    /**
     * Returns a list containing the first {@code n} elements.
     */
    public static <T> List<T> take(List<? extends T> list, int n) {
        return copyOf(list, 0, clamp(n, list.size()));
    }

    /**
     * Returns a list containing the last {@code n} elements.
     */
    public static <T> List<T> takeLast(List<? extends T> list, int n) {
        int size = list.size();
        return copyOf(list, size - clamp(n, size), size);
    }

    /**
     * Returns a list containing the leading elements that satisfy the
     * given predicate.
     */
    public static <T> List<T> takeWhile(List<? extends T> list, Predicate<? super T> p) {
        return copyOf(list, 0, leading(list, p));
    }

    /**
     * Returns a list containing the trailing elements that satisfy the
     * given predicate.
     */
    public static <T> List<T> takeLastWhile(List<? extends T> list, Predicate<? super T> p) {
        return copyOf(list, trailing(list, p), list.size());
    }

    /**
     * Returns a list containing all elements except the first {@code n}.
     */
    public static <T> List<T> drop(List<? extends T> list, int n) {
        int size = list.size();
        return copyOf(list, clamp(n, size), size);
    }

    /**
     * Returns a list containing all elements except the last {@code n}.
     */
    public static <T> List<T> dropLast(List<? extends T> list, int n) {
        int size = list.size();
        return copyOf(list, 0, size - clamp(n, size));
    }

    /**
     * Returns a list without the leading elements that satisfy the given
     * predicate.
     */
    public static <T> List<T> dropWhile(List<? extends T> list, Predicate<? super T> p) {
        return copyOf(list, leading(list, p), list.size());
    }

    /**
     * Returns a list without the trailing elements that satisfy the given
     * predicate.
     */
    public static <T> List<T> dropLastWhile(List<? extends T> list, Predicate<? super T> p) {
        return copyOf(list, 0, trailing(list, p));
    }

    /**
     * Reverses the elements of the given list in place. This is the only
     * operation in the library that modifies its input.
     *
     * @throws UnsupportedOperationException if the list is not modifiable
     */
    public static void reverse(List<?> list) {
        Collections.reverse(list);
    }

    /**
     * Returns a new list with the elements in reverse order.
     */
    public static <T> List<T> reversed(List<? extends T> list) {
        List<T> result = Lists.newArrayListWithCapacity(list.size());
        for (int i = list.size() - 1; i >= 0; i--) {
            result.add(list.get(i));
        }
        return result;
    }

    // index of the first element not matching the predicate
    private static <T> int leading(List<? extends T> list, Predicate<? super T> p) {
        ListIterator<? extends T> it = list.listIterator();
        while (it.hasNext()) {
            if (!p.test(it.next()))
                return it.previousIndex();
        }
        return list.size();
    }

    // index just past the last element not matching the predicate
    private static <T> int trailing(List<? extends T> list, Predicate<? super T> p) {
        ListIterator<? extends T> it = list.listIterator(list.size());
        while (it.hasPrevious()) {
            if (!p.test(it.previous()))
                return it.nextIndex() + 1;
        }
        return 0;
    }

    private static int clamp(int n, int size) {
        return n <= 0 ? 0 : Math.min(n, size);
    }

    static <T> List<T> copyOf(List<? extends T> list, int from, int to) {
        return new ArrayList<>(list.subList(from, to));
    }
}
