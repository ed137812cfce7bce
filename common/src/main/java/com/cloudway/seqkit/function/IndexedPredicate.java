/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.seqkit.function;

/**
 * Represents a predicate of an element and its position in a sequence.
 *
 * @param <T> the type of the element
 */
@FunctionalInterface
public interface IndexedPredicate<T>
{
    /**
     * Evaluates this predicate on the given element.
     *
     * @param index the zero-based position of the element
     * @param t the element
     * @return {@code true} if the element matches the predicate
     */
    boolean test(int index, T t);
}
