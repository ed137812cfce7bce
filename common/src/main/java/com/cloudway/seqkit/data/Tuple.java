/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.seqkit.data;

import java.io.Serializable;
import java.util.Comparator;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * An immutable tuple with two elements. Two tuples are equal when both of
 * their elements are equal.
 *
 * @param <A> the type of the first element
 * @param <B> the type of the second element
 */
public class Tuple<A, B> implements Serializable
{
    private static final long serialVersionUID = 4183504129067733628L;

    private final A first;
    private final B second;

    /**
     * Construct a new Tuple with two arguments.
     *
     * @param first the first argument
     * @param second the second argument
     */
    public Tuple(A first, B second) {
        this.first = first;
        this.second = second;
    }

    /**
     * Construct a new Tuple with two arguments.
     *
     * @param first the first argument
     * @param second the second argument
     */
    public static <A, B> Tuple<A, B> of(A first, B second) {
        return new Tuple<>(first, second);
    }

    /**
     * Construct a new Tuple with two elements of same type.
     *
     * @param first the first argument
     * @param second the second argument
     */
    public static <A> Pair<A> pair(A first, A second) {
        return new Pair<>(first, second);
    }

    /**
     * Returns the first element.
     */
    public A first() {
        return first;
    }

    /**
     * Returns the second element.
     */
    public B second() {
        return second;
    }

    /**
     * Get a tuple with two elements swapped.
     */
    public Tuple<B, A> swap() {
        return new Tuple<>(second, first);
    }

    /**
     * Apply this tuple as arguments to a function.
     */
    public <R> R as(BiFunction<? super A, ? super B, ? extends R> fn) {
        return fn.apply(first, second);
    }

    /**
     * Applies two elements as arguments to two given functions and return
     * a new tuple with the substituted arguments.
     */
    public <X, Y> Tuple<X, Y> map(Function<? super A, ? extends X> f,
                                  Function<? super B, ? extends Y> g) {
        return of(f.apply(first), g.apply(second));
    }

    public <R> Tuple<R, B> mapFirst(Function<? super A, ? extends R> fn) {
        return of(fn.apply(first), second);
    }

    public <R> Tuple<A, R> mapSecond(Function<? super B, ? extends R> fn) {
        return of(first, fn.apply(second));
    }

    /**
     * Returns a predicate that evaluate first element as argument to the
     * given predicate.
     */
    public static <A, B> Predicate<Tuple<A, B>> first(Predicate<? super A> p) {
        return t -> p.test(t.first());
    }

    /**
     * Returns a predicate that evaluate second element as argument to the
     * given predicate.
     */
    public static <A, B> Predicate<Tuple<A, B>> second(Predicate<? super B> p) {
        return t -> p.test(t.second());
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Tuple))
            return false;

        Tuple<?, ?> other = (Tuple<?, ?>)obj;
        return Objects.equals(first, other.first)
            && Objects.equals(second, other.second);
    }

    @Override
    public int hashCode() {
        return 31 * (31 + Objects.hashCode(first)) + Objects.hashCode(second);
    }

    @Override
    public String toString() {
        return "(" + first + "," + second + ")";
    }

    /**
     * Returns a comparator that orders tuples by their first element, then
     * by their second element.
     */
    public static <A extends Comparable<? super A>, B extends Comparable<? super B>>
    Comparator<Tuple<A, B>> comparator() {
        return Comparator.<Tuple<A, B>, A>comparing(Tuple::first).thenComparing(Tuple::second);
    }

    public static <A, B> Comparator<Tuple<A, B>>
    comparator(Comparator<? super A> firstComparator, Comparator<? super B> secondComparator) {
        return Comparator.<Tuple<A, B>, A>comparing(Tuple::first, firstComparator)
            .thenComparing(Tuple::second, secondComparator);
    }
}
