/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package net.fingerseq.data;

import java.util.Comparator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * The greatest key of a sorted sequence, or none for an empty one.
 *
 * <p>The monoid is right-biased: appending keeps the right operand unless
 * it is none. This equals the maximum only while the measured sequence is
 * kept in ascending key order, which every ordered collection guarantees.
 *
 * @param <K> the key type
 */
public final class Max<K> {
    private static final Max<?> NONE = new Max<>(null);

    private static final Monoid<Max<?>> MONOID =
        Monoid.monoid(NONE, (a1, a2) -> a2.isNone() ? a1 : a2);

    private final K key;

    private Max(K key) {
        this.key = key;
    }

    @SuppressWarnings("unchecked")
    public static <K> Max<K> none() {
        return (Max<K>)NONE;
    }

    public static <K> Max<K> of(K key) {
        return new Max<>(Objects.requireNonNull(key));
    }

    @SuppressWarnings("unchecked")
    public static <K> Monoid<Max<K>> monoid() {
        return (Monoid<Max<K>>)(Monoid<?>)MONOID;
    }

    public boolean isNone() {
        return this == NONE;
    }

    /**
     * Returns the key.
     *
     * @throws NoSuchElementException if this is none
     */
    public K get() {
        if (key == null)
            throw new NoSuchElementException();
        return key;
    }

    /**
     * Tests whether this maximum has reached the given key. Monotone over
     * the accumulated measure of an ascending sequence, so it can drive a
     * finger tree split or lookup.
     */
    public boolean isAtLeast(K k, Comparator<? super K> c) {
        return key != null && c.compare(key, k) >= 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Max))
            return false;
        return Objects.equals(key, ((Max<?>)obj).key);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(key);
    }

    @Override
    public String toString() {
        return key == null ? "Max.none" : "Max " + key;
    }
}
