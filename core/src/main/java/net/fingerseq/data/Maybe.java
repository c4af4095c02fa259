/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package net.fingerseq.data;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * An optional result. Lookups, views and order statistics answer with
 * {@code Maybe} when the collection has nothing at the requested position,
 * and {@link FingerTree#alter alter} hands the element it found (if any) to
 * its callback as one.
 *
 * <p>A {@code Maybe} never holds {@code null}. As a {@link Foldable} it
 * folds over zero or one element.
 *
 * @param <A> the type of the held value
 */
public final class Maybe<A> implements Foldable<A> {
    private static final Maybe<?> NOTHING = new Maybe<>(null);

    private final A value;

    private Maybe(A value) {
        this.value = value;
    }

    /**
     * Returns the absent result.
     */
    public static <A> Maybe<A> empty() {
        @SuppressWarnings("unchecked")
        Maybe<A> nothing = (Maybe<A>)NOTHING;
        return nothing;
    }

    /**
     * Wraps a present value.
     *
     * @throws NullPointerException if the value is null
     */
    public static <A> Maybe<A> of(A value) {
        return new Maybe<>(Objects.requireNonNull(value));
    }

    /**
     * Returns the held value.
     *
     * @throws NoSuchElementException if this is the absent result
     */
    public A get() {
        if (value == null)
            throw new NoSuchElementException("Nothing");
        return value;
    }

    public boolean isPresent() {
        return value != null;
    }

    public boolean isAbsent() {
        return value == null;
    }

    /**
     * Keeps the value only when it satisfies the predicate.
     */
    public Maybe<A> filter(Predicate<? super A> p) {
        return value != null && p.test(value) ? this : empty();
    }

    /**
     * Applies the function to a present value. The function must not
     * return {@code null}.
     */
    public <B> Maybe<B> map(Function<? super A, ? extends B> f) {
        return value != null ? of(f.apply(value)) : empty();
    }

    public A orElse(A other) {
        return value != null ? value : other;
    }

    @Override
    public <R> R foldLeft(R z, BiFunction<R, ? super A, R> f) {
        return value != null ? f.apply(z, value) : z;
    }

    @Override
    public <R> R foldRight(R z, BiFunction<? super A, R, R> f) {
        return value != null ? f.apply(value, z) : z;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Maybe))
            return false;
        return Objects.equals(value, ((Maybe<?>)obj).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value != null ? "Just " + value : "Nothing";
    }
}
