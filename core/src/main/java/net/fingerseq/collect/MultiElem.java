/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package net.fingerseq.collect;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.IntUnaryOperator;

import net.fingerseq.data.FingerTree;
import net.fingerseq.data.Foldable;
import net.fingerseq.data.Max;
import net.fingerseq.data.Maybe;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A value together with its number of occurrences in a multiset. A record
 * never holds a multiplicity below 1: every change of multiplicity goes
 * through {@link #changeMultiplicity}, which yields nothing instead.
 *
 * <p>Folding a record visits its value once per occurrence.
 *
 * @param <T> the value type
 */
final class MultiElem<T> implements Foldable<T> {
    private static final FingerTree.Maker<MultiMeasure<Object>, MultiElem<Object>> MAKER =
        FingerTree.maker(MultiMeasure.monoid(), MultiElem::measure);

    final T value;
    final int multiplicity;

    private MultiElem(T value, int multiplicity) {
        this.value = value;
        this.multiplicity = multiplicity;
    }

    static <T> MultiElem<T> of(T value) {
        return new MultiElem<>(Objects.requireNonNull(value), 1);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static <T> FingerTree.Maker<MultiMeasure<T>, MultiElem<T>> maker() {
        return (FingerTree.Maker)MAKER;
    }

    MultiMeasure<T> measure() {
        return new MultiMeasure<>(multiplicity, 1, Max.of(value));
    }

    /**
     * Computes a new multiplicity for this record.
     *
     * @return the record with the new multiplicity, or nothing if the new
     * multiplicity is not positive
     */
    Maybe<MultiElem<T>> changeMultiplicity(IntUnaryOperator f) {
        int m = f.applyAsInt(multiplicity);
        if (m <= 0) {
            return Maybe.empty();
        } else if (m == multiplicity) {
            return Maybe.of(this);
        } else {
            return Maybe.of(new MultiElem<>(value, m));
        }
    }

    MultiElem<T> setMultiplicity(int m) {
        checkArgument(m >= 1, "multiplicity must be positive: %s", m);
        return changeMultiplicity(x -> m).get();
    }

    MultiElem<T> increment() {
        return add(1);
    }

    MultiElem<T> add(int n) {
        return changeMultiplicity(m -> Math.addExact(m, n)).get();
    }

    Maybe<MultiElem<T>> decrement() {
        return changeMultiplicity(m -> m - 1);
    }

    // The binary operations assume both records hold equal values.

    MultiElem<T> sum(MultiElem<T> other) {
        return add(other.multiplicity);
    }

    MultiElem<T> min(MultiElem<T> other) {
        return changeMultiplicity(m -> Math.min(m, other.multiplicity)).get();
    }

    Maybe<MultiElem<T>> difference(MultiElem<T> other) {
        return changeMultiplicity(m -> m - other.multiplicity);
    }

    <R> MultiElem<R> mapValue(Function<? super T, ? extends R> f) {
        return new MultiElem<>(Objects.requireNonNull(f.apply(value)), multiplicity);
    }

    @Override
    public <R> R foldLeft(R z, BiFunction<R, ? super T, R> f) {
        for (int i = 0; i < multiplicity; i++) {
            z = f.apply(z, value);
        }
        return z;
    }

    @Override
    public <R> R foldRight(R z, BiFunction<? super T, R, R> f) {
        for (int i = 0; i < multiplicity; i++) {
            z = f.apply(value, z);
        }
        return z;
    }

    @Override
    public String toString() {
        return value + "*" + multiplicity;
    }
}
