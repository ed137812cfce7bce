/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.seqkit.util;

import java.util.Iterator;
import java.util.List;
import java.util.function.BiFunction;

import com.google.common.collect.Lists;

import com.cloudway.seqkit.data.Tuple;

/**
 * Combines two lists into a list of tuples and splits it back.
 */
public final class Zips
{
    private Zips() {}

    /**
     * Returns a list of tuples built from the elements of both lists with
     * the same index. The result is as long as the shorter list; trailing
     * elements of the longer list are discarded.
     */
    public static <A, B> List<Tuple<A, B>> zip(List<? extends A> as, List<? extends B> bs) {
        return zip(as, bs, Tuple::of);
    }

    /**
     * Returns a list of values built by applying the given function to the
     * elements of both lists with the same index.
     */
    public static <A, B, R> List<R> zip(List<? extends A> as, List<? extends B> bs,
                                        BiFunction<? super A, ? super B, ? extends R> f) {
        List<R> result = Lists.newArrayListWithCapacity(Math.min(as.size(), bs.size()));
        Iterator<? extends A> ia = as.iterator();
        Iterator<? extends B> ib = bs.iterator();
        while (ia.hasNext() && ib.hasNext()) {
            result.add(f.apply(ia.next(), ib.next()));
        }
        return result;
    }

    /**
     * Splits a list of tuples into the list of first elements and the list
     * of second elements. Both lists have the same length as the input.
     */
    public static <A, B> Tuple<List<A>, List<B>> unzip(List<? extends Tuple<? extends A, ? extends B>> tuples) {
        List<A> firsts = Lists.newArrayListWithCapacity(tuples.size());
        List<B> seconds = Lists.newArrayListWithCapacity(tuples.size());
        for (Tuple<? extends A, ? extends B> t : tuples) {
            firsts.add(t.first());
            seconds.add(t.second());
        }
        return Tuple.of(firsts, seconds);
    }
}
