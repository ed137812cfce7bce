/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.seqkit.function;

/**
 * Represents an accumulating function that receives the position of the
 * element being combined, the accumulated value, and the element.
 *
 * @param <R> the type of the accumulated value
 * @param <T> the type of the element
 */
@FunctionalInterface
public interface IndexedBiFunction<R, T>
{
    R apply(int index, R acc, T t);
}
