/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package net.fingerseq.data;

import java.util.NoSuchElementException;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Provides 2-3 finger trees, a functional representation of persistent sequences
 * supporting access to the ends in amortized O(1) time. Concatenation and
 * splitting time is O(log n) in the size of the smaller piece.
 *
 * <p>The tree is annotated with a monoidal measure. Searching is driven by a
 * predicate on the accumulated measure that must be monotone: once it turns
 * true for some prefix it stays true for every longer prefix. With a size
 * measure this gives indexing, with a maximum-key measure it gives ordered
 * search, and both can be combined in one measure.
 *
 * <p>Based on "Finger trees: a simple general-purpose data structure", by Ralf
 * Hinze and Ross Paterson.
 *
 * @param <V> The monoidal type with which to annotate nodes
 * @param <A> The type of the tree's elements
 */
public interface FingerTree<V, A> extends Foldable<A> {
    /**
     * Constructs trees and determines how the elements of a tree are
     * measured and how measures are summed.
     */
    interface Maker<V, A> {
        /**
         * Measure a given element.
         *
         * @param a an element to measure
         * @return the element's measurement
         */
        V measure(A a);

        /**
         * Returns the identity measurement for the monoid.
         */
        V zero();

        /**
         * Sums the given measurements with the monoid.
         */
        V sum(V a, V b);

        /**
         * Construct an empty tree.
         */
        FingerTree<V, A> empty();

        /**
         * Construct a singleton tree.
         *
         * @param value the single element for the tree
         */
        FingerTree<V, A> singleton(A value);
    }

    /**
     * Construct a Maker instance for the element type, given a monoid and
     * a measuring function.
     *
     * @param monoid a monoid for the measures
     * @param measure a function with which to measure element values
     * @return a Maker instance that uses the given measuring function
     */
    static <V, A> Maker<V, A> maker(Monoid<V> monoid, Function<? super A, ? extends V> measure) {
        return new FingerTreeImpl.MonoidMaker<>(monoid, measure);
    }

    /**
     * Returns the maker that built this tree.
     */
    Maker<V, A> maker();

    /**
     * Indicates whether this tree is empty.
     */
    boolean isEmpty();

    /**
     * Returns the sum of this tree's annotations.
     */
    V measure();

    /**
     * Returns the first element of the tree.
     *
     * @throws NoSuchElementException if the tree is empty
     */
    A head();

    /**
     * Returns the last element of the tree.
     *
     * @throws NoSuchElementException if the tree is empty
     */
    A last();

    /**
     * Returns the elements after the head of the tree.
     *
     * @throws NoSuchElementException if the tree is empty
     */
    FingerTree<V, A> tail();

    /**
     * Returns all the elements of the tree except the last one.
     *
     * @throws NoSuchElementException if the tree is empty
     */
    FingerTree<V, A> init();

    /**
     * Decompose the tree into its first element and the rest.
     *
     * @return the head and the tail, or nothing if the tree is empty
     */
    default Maybe<Tuple<A, FingerTree<V, A>>> viewLeft() {
        return isEmpty() ? Maybe.empty() : Maybe.of(Tuple.of(head(), tail()));
    }

    /**
     * Decompose the tree into its leading elements and the last one.
     *
     * @return the init and the last, or nothing if the tree is empty
     */
    default Maybe<Tuple<FingerTree<V, A>, A>> viewRight() {
        return isEmpty() ? Maybe.empty() : Maybe.of(Tuple.of(init(), last()));
    }

    /**
     * Adds the given element to this tree as the first element.
     */
    FingerTree<V, A> cons(A a);

    /**
     * Adds the given element to this tree as the last element.
     */
    FingerTree<V, A> snoc(A a);

    /**
     * Appends one finger tree to another.
     *
     * @param that a finger tree to append to this one
     * @return the concatenation of this tree and the given tree
     */
    FingerTree<V, A> append(FingerTree<V, A> that);

    /**
     * Lookup an element in the tree at a point where the predicate on the
     * accumulated measure changes from 'false' to 'true'.
     *
     * @param p the predicate to test on the accumulated measure
     * @return the element at the satisfied point, or nothing if the predicate
     * is false for the whole tree
     */
    Maybe<A> lookup(Predicate<? super V> p);

    /**
     * Replaces the element in the tree at a point where the predicate on the
     * accumulated measure changes from 'false' to 'true'.
     *
     * <p>The measurement of the replacement must be identical to the old one.
     *
     * @param p the predicate to test on the accumulated measure
     * @param f a function that compute from old value to new value
     * @return a new tree with the element replaced, or this tree if there is
     * no satisfied point
     */
    FingerTree<V, A> modify(Predicate<? super V> p, UnaryOperator<A> f);

    /**
     * Split a tree at a point where the predicate on the accumulated
     * measure changes from 'false' to 'true'. The right tree starts with the
     * element at that point. If there is no such point the right tree is
     * empty.
     *
     * @param p the predicate to test on the accumulated measure
     * @return a pair of split trees
     */
    Pair<FingerTree<V, A>> split(Predicate<? super V> p);

    /**
     * Returns the elements before the point where the predicate turns true.
     */
    default FingerTree<V, A> takeUntil(Predicate<? super V> p) {
        return split(p).first();
    }

    /**
     * Returns the elements from the point where the predicate turns true.
     */
    default FingerTree<V, A> dropUntil(Predicate<? super V> p) {
        return split(p).second();
    }

    /**
     * Splices a run of elements in place of the element at the point where
     * the predicate on the accumulated measure turns true.
     *
     * <p>The function receives that element, or nothing when the predicate
     * never holds, and returns the elements to put in its place: none
     * deletes it, one replaces it, more inserts around it. When nothing is
     * found the returned elements are added at the end of the tree. The
     * caller keeps the result consistent with the measure, e.g. preserves
     * the ordering of an ordered tree.
     *
     * @param p the predicate to test on the accumulated measure
     * @param f computes the replacement elements
     * @return the altered tree
     */
    default FingerTree<V, A> alter(Predicate<? super V> p,
                                   Function<? super Maybe<A>, ? extends Iterable<? extends A>> f) {
        Pair<FingerTree<V, A>> halves = split(p);
        Maybe<Tuple<A, FingerTree<V, A>>> view = halves.second().viewLeft();

        FingerTree<V, A> left = halves.first();
        for (A a : f.apply(view.map(Tuple::first))) {
            left = left.snoc(a);
        }
        return left.append(view.isPresent() ? view.get().second() : halves.second());
    }

    /**
     * Maps the given function across this tree, measuring with the given
     * maker.
     *
     * @param f a function to map across the values of this tree
     * @param m a maker with which to annotate the new tree
     */
    <W, B> FingerTree<W, B> map(Function<? super A, ? extends B> f, Maker<W, B> m);

    /**
     * Reverse elements in this tree.
     */
    FingerTree<V, A> reverse();
}
