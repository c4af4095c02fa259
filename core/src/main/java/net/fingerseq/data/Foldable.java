/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package net.fingerseq.data;

import java.util.Iterator;
import java.util.StringJoiner;
import java.util.function.BiFunction;

import com.google.common.collect.ImmutableList;

/**
 * Class of data structures that can be folded to a summary value.
 *
 * <p><strong>Minimal complete definition</strong></p>
 * <p>
 * {@link #foldLeft(Object,BiFunction) foldLeft} |
 * {@link #foldRight(Object,BiFunction) foldRight}
 * </p>
 *
 * @param <T> the type of the data structure element
 */
public interface Foldable<T> extends Iterable<T> {
    /**
     * Reduce the data structure using the binary operator, from left to right.
     *
     * @param <R> the type of the result
     * @param z the identity of the result
     * @param f an associative non-interfering function for combining two values
     * @return the result of the reduction
     */
    <R> R foldLeft(R z, BiFunction<R, ? super T, R> f);

    /**
     * Reduce the data structure using the binary operator, from right to left.
     *
     * @param <R> the type of the result
     * @param z the identity of the result
     * @param f an associative non-interfering function for combining two values
     * @return the result of the reduction
     */
    <R> R foldRight(R z, BiFunction<? super T, R, R> f);

    /**
     * Returns an iterator over a snapshot of the elements of the structure.
     *
     * @return an Iterator
     */
    @Override
    default Iterator<T> iterator() {
        return toList().iterator();
    }

    /**
     * Fold elements to a list, from left to right.
     *
     * @return a list of elements contained in the data structure
     */
    default ImmutableList<T> toList() {
        return foldLeft(ImmutableList.<T>builder(), (b, x) -> b.add(x)).build();
    }

    /**
     * Returns the string representation of the data structure.
     *
     * @param delimiter the sequence of character to be used between element
     * @param prefix the sequence of characters to be used at the beginning
     * @param suffix the sequence of characters to be used at the end
     */
    default String show(CharSequence delimiter, CharSequence prefix, CharSequence suffix) {
        return foldLeft(new StringJoiner(delimiter, prefix, suffix),
                        (sj, x) -> sj.add(String.valueOf(x))).toString();
    }
}
