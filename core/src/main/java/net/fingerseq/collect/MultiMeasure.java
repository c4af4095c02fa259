/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package net.fingerseq.collect;

import com.google.common.base.MoreObjects;

import net.fingerseq.data.Max;
import net.fingerseq.data.Monoid;

/**
 * The annotation of a multiset tree: the total number of occurrences, the
 * number of distinct values and the greatest value.
 */
final class MultiMeasure<T> {
    private static final MultiMeasure<?> EMPTY = new MultiMeasure<>(0, 0, Max.none());

    final int cardinality;
    final int supportSize;
    final Max<T> max;

    MultiMeasure(int cardinality, int supportSize, Max<T> max) {
        this.cardinality = cardinality;
        this.supportSize = supportSize;
        this.max = max;
    }

    @SuppressWarnings("unchecked")
    static <T> MultiMeasure<T> empty() {
        return (MultiMeasure<T>)EMPTY;
    }

    static <T> Monoid<MultiMeasure<T>> monoid() {
        Monoid<Max<T>> maxMonoid = Max.monoid();
        return Monoid.monoid(empty(), (a, b) ->
            a == EMPTY ? b :
            b == EMPTY ? a :
            new MultiMeasure<>(Math.addExact(a.cardinality, b.cardinality),
                               a.supportSize + b.supportSize,
                               maxMonoid.append(a.max, b.max)));
    }

    int cardinality() {
        return cardinality;
    }

    int supportSize() {
        return supportSize;
    }

    Max<T> max() {
        return max;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("cardinality", cardinality)
            .add("supportSize", supportSize)
            .add("max", max)
            .toString();
    }
}
