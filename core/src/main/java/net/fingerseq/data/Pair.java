/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package net.fingerseq.data;

import java.util.function.Function;

/**
 * A pair of two elements with same type.
 *
 * @param <T> the elements type
 */
public class Pair<T> extends Tuple<T, T> {
    public Pair(T first, T second) {
        super(first, second);
    }

    public <R> Pair<R> map2(Function<? super T, ? extends R> f) {
        return new Pair<>(f.apply(first()), f.apply(second()));
    }
}
