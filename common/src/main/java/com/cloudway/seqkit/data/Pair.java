/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.seqkit.data;

import java.util.function.Function;

/**
 * A pair of two elements with same type.
 *
 * @param <T> the elements type
 */
public class Pair<T> extends Tuple<T, T> {
    private static final long serialVersionUID = -6642851047716823109L;

    public Pair(T first, T second) {
        super(first, second);
    }

    @Override
    public Pair<T> swap() {
        return new Pair<>(second(), first());
    }

    public <R> Pair<R> map2(Function<? super T, ? extends R> f) {
        return new Pair<>(f.apply(first()), f.apply(second()));
    }
}
