/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package net.fingerseq.collect;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.BiFunction;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import net.fingerseq.data.FingerTree;
import net.fingerseq.data.Foldable;
import net.fingerseq.data.Maybe;
import net.fingerseq.data.Tuple;

import static java.util.Objects.requireNonNull;

/**
 * A persistent double-ended queue. Elements can be added and removed at both
 * ends in amortized constant time, and the size is known in constant time.
 * Two deques are concatenated in logarithmic time.
 *
 * <p>Every operation returns a new deque and leaves the receiver unchanged.
 * Null elements are not permitted.
 *
 * @param <T> the element type
 */
public final class Deque<T> implements Foldable<T> {
    private static final Deque<?> EMPTY = new Deque<>(Elem.maker().empty());

    private final FingerTree<Integer, Elem<T>> tree;

    private Deque(FingerTree<Integer, Elem<T>> tree) {
        this.tree = tree;
    }

    private static <T> FingerTree.Maker<Integer, Elem<T>> maker() {
        return Elem.maker();
    }

    /**
     * Returns the empty deque.
     */
    @SuppressWarnings("unchecked")
    public static <T> Deque<T> empty() {
        return (Deque<T>)EMPTY;
    }

    /**
     * Returns a deque with the single given element.
     */
    public static <T> Deque<T> singleton(T x) {
        return new Deque<>(Deque.<T>maker().singleton(new Elem<>(x)));
    }

    /**
     * Returns a deque with the given elements, first to last.
     */
    @SafeVarargs
    public static <T> Deque<T> of(T... xs) {
        return fromList(ImmutableList.copyOf(xs));
    }

    /**
     * Builds a deque whose front-to-back order is the traversal order of the
     * given elements.
     */
    public static <T> Deque<T> fromList(Iterable<? extends T> xs) {
        FingerTree<Integer, Elem<T>> t = Deque.<T>maker().empty();
        for (T x : ImmutableList.copyOf(xs).reverse()) {
            t = t.cons(new Elem<>(x));
        }
        return new Deque<>(t);
    }

    public boolean isEmpty() {
        return tree.isEmpty();
    }

    /**
     * Returns the number of elements, in constant time.
     */
    public int size() {
        return tree.measure();
    }

    public Deque<T> pushFront(T x) {
        return new Deque<>(tree.cons(new Elem<>(x)));
    }

    public Deque<T> pushBack(T x) {
        return new Deque<>(tree.snoc(new Elem<>(x)));
    }

    /**
     * Decompose this deque into its first element and the remaining deque.
     *
     * @return the first element and the rest, or nothing if this deque is empty
     */
    public Maybe<Tuple<T, Deque<T>>> viewFront() {
        return tree.viewLeft().map(t -> Tuple.of(t.first().value, new Deque<>(t.second())));
    }

    /**
     * Decompose this deque into the leading elements and its last element.
     *
     * @return the rest and the last element, or nothing if this deque is empty
     */
    public Maybe<Tuple<Deque<T>, T>> viewBack() {
        return tree.viewRight().map(t -> Tuple.of(new Deque<>(t.first()), t.second().value));
    }

    /**
     * Returns the first element.
     *
     * @throws NoSuchElementException if this deque is empty
     */
    public T head() {
        return tree.head().value;
    }

    /**
     * Returns the last element.
     *
     * @throws NoSuchElementException if this deque is empty
     */
    public T last() {
        return tree.last().value;
    }

    /**
     * Returns the deque without its first element.
     *
     * @throws NoSuchElementException if this deque is empty
     */
    public Deque<T> tail() {
        return new Deque<>(tree.tail());
    }

    /**
     * Returns the deque without its last element.
     *
     * @throws NoSuchElementException if this deque is empty
     */
    public Deque<T> init() {
        return new Deque<>(tree.init());
    }

    /**
     * Returns the elements of this deque followed by the elements of the
     * other deque.
     */
    public Deque<T> append(Deque<T> other) {
        return new Deque<>(tree.append(other.tree));
    }

    public <R> Deque<R> map(Function<? super T, ? extends R> f) {
        requireNonNull(f);
        return new Deque<>(tree.map(e -> e.mapValue(f), Deque.<R>maker()));
    }

    public Deque<T> reverse() {
        return new Deque<>(tree.reverse());
    }

    @Override
    public <R> R foldLeft(R z, BiFunction<R, ? super T, R> f) {
        return tree.foldLeft(z, (r, e) -> f.apply(r, e.value));
    }

    @Override
    public <R> R foldRight(R z, BiFunction<? super T, R, R> f) {
        return tree.foldRight(z, (e, r) -> f.apply(e.value, r));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Deque))
            return false;
        Deque<?> other = (Deque<?>)obj;
        return size() == other.size() && Iterables.elementsEqual(this, other);
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (Iterator<T> it = iterator(); it.hasNext(); ) {
            h = 31 * h + it.next().hashCode();
        }
        return h;
    }

    @Override
    public String toString() {
        return show(", ", "Deque[", "]");
    }
}
