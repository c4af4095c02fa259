/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package net.fingerseq.collect;

import java.util.Objects;
import java.util.function.Function;

import net.fingerseq.data.FingerTree;
import net.fingerseq.data.Monoid;

/**
 * A single occurrence of a value in a sequence. Each element measures 1, so
 * the measure of a tree of elements is its length.
 *
 * @param <T> the value type
 */
final class Elem<T> {
    private static final FingerTree.Maker<Integer, Elem<?>> MAKER =
        FingerTree.maker(Monoid.intSum, x -> 1);

    final T value;

    Elem(T value) {
        this.value = Objects.requireNonNull(value);
    }

    @SuppressWarnings("unchecked")
    static <T> FingerTree.Maker<Integer, Elem<T>> maker() {
        return (FingerTree.Maker<Integer, Elem<T>>)(FingerTree.Maker<Integer, ?>)MAKER;
    }

    <R> Elem<R> mapValue(Function<? super T, ? extends R> f) {
        return new Elem<>(f.apply(value));
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
