/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.seqkit.function;

/**
 * Represents a function that accepts an element together with its position
 * in a sequence and produces a result.
 *
 * @param <T> the type of the element
 * @param <R> the type of the result of the function
 */
@FunctionalInterface
public interface IndexedFunction<T, R>
{
    /**
     * Applies this function to the given element.
     *
     * @param index the zero-based position of the element
     * @param t the element
     * @return the function result
     */
    R apply(int index, T t);
}
