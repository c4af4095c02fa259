/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package net.fingerseq.collect;

import net.fingerseq.data.Max;
import net.fingerseq.data.Monoid;

/**
 * The annotation of an ordered set tree: element count and greatest element.
 */
final class SizeMax<T> {
    private static final SizeMax<?> EMPTY = new SizeMax<>(0, Max.none());

    final int size;
    final Max<T> max;

    SizeMax(int size, Max<T> max) {
        this.size = size;
        this.max = max;
    }

    static <T> SizeMax<T> of(T value) {
        return new SizeMax<>(1, Max.of(value));
    }

    @SuppressWarnings("unchecked")
    static <T> Monoid<SizeMax<T>> monoid() {
        Monoid<Max<T>> maxMonoid = Max.monoid();
        return Monoid.monoid((SizeMax<T>)EMPTY, (a, b) ->
            a == EMPTY ? b :
            b == EMPTY ? a :
            new SizeMax<>(a.size + b.size, maxMonoid.append(a.max, b.max)));
    }

    int size() {
        return size;
    }

    Max<T> max() {
        return max;
    }

    @Override
    public String toString() {
        return "(" + size + ", " + max + ")";
    }
}
