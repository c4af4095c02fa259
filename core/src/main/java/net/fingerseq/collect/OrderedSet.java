/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package net.fingerseq.collect;

import java.util.Comparator;
import java.util.Iterator;
import java.util.function.BiFunction;

import com.google.common.collect.ImmutableList;

import net.fingerseq.data.FingerTree;
import net.fingerseq.data.Foldable;
import net.fingerseq.data.Maybe;
import net.fingerseq.data.OrderedMerge;

import static java.util.Objects.requireNonNull;

/**
 * A persistent set of distinct elements kept in ascending order. Searching,
 * insertion and deletion take logarithmic time, the size is known in
 * constant time.
 *
 * @param <E> the element type
 */
public final class OrderedSet<E> implements Foldable<E> {
    private static final FingerTree.Maker<SizeMax<Object>, Object> MAKER =
        FingerTree.maker(SizeMax.monoid(), SizeMax::of);

    private final Comparator<? super E> comparator;
    private final FingerTree<SizeMax<E>, E> tree;

    private OrderedSet(Comparator<? super E> comparator, FingerTree<SizeMax<E>, E> tree) {
        this.comparator = comparator;
        this.tree = tree;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static <E> FingerTree.Maker<SizeMax<E>, E> maker() {
        return (FingerTree.Maker)MAKER;
    }

    private OrderedSet<E> with(FingerTree<SizeMax<E>, E> t) {
        return t == tree ? this : new OrderedSet<>(comparator, t);
    }

    private OrderedMerge<SizeMax<E>, E, E> merge() {
        return new OrderedMerge<>(SizeMax::max, x -> x, comparator);
    }

    // Construction

    public static <E extends Comparable<? super E>> OrderedSet<E> empty() {
        return empty(Comparator.naturalOrder());
    }

    public static <E> OrderedSet<E> empty(Comparator<? super E> c) {
        return new OrderedSet<>(requireNonNull(c), OrderedSet.<E>maker().empty());
    }

    public static <E extends Comparable<? super E>> OrderedSet<E> singleton(E x) {
        return singleton(Comparator.naturalOrder(), x);
    }

    public static <E> OrderedSet<E> singleton(Comparator<? super E> c, E x) {
        return new OrderedSet<>(requireNonNull(c), OrderedSet.<E>maker().singleton(requireNonNull(x)));
    }

    @SafeVarargs
    public static <E extends Comparable<? super E>> OrderedSet<E> of(E... xs) {
        return fromList(ImmutableList.copyOf(xs));
    }

    /**
     * Builds a set from elements in any order, discarding duplicates.
     */
    public static <E extends Comparable<? super E>> OrderedSet<E> fromList(Iterable<? extends E> xs) {
        return fromList(Comparator.naturalOrder(), xs);
    }

    public static <E> OrderedSet<E> fromList(Comparator<? super E> c, Iterable<? extends E> xs) {
        OrderedSet<E> s = empty(c);
        for (E x : xs) {
            s = s.insert(x);
        }
        return s;
    }

    /**
     * Builds a set in linear time from elements given in strictly ascending
     * order. The order is not verified unless invariant checks are enabled.
     *
     * @throws IllegalArgumentException if invariant checks are enabled and
     * the elements are not strictly ascending
     */
    public static <E extends Comparable<? super E>> OrderedSet<E> fromDistinctAscList(Iterable<? extends E> xs) {
        return fromDistinctAscList(Comparator.naturalOrder(), xs);
    }

    public static <E> OrderedSet<E> fromDistinctAscList(Comparator<? super E> c, Iterable<? extends E> xs) {
        requireNonNull(c);
        boolean check = InvariantChecks.enabled();
        FingerTree<SizeMax<E>, E> t = OrderedSet.<E>maker().empty();
        for (E x : xs) {
            requireNonNull(x);
            if (check && !t.isEmpty()) {
                InvariantChecks.checkAscending(c, t.last(), x, true, "fromDistinctAscList");
            }
            t = t.snoc(x);
        }
        return new OrderedSet<>(c, t);
    }

    // Queries

    public boolean isEmpty() {
        return tree.isEmpty();
    }

    /**
     * Returns the number of elements, in constant time.
     */
    public int size() {
        return tree.measure().size;
    }

    public Comparator<? super E> comparator() {
        return comparator;
    }

    public boolean contains(E x) {
        requireNonNull(x);
        return tree.lookup(merge().atLeast(x))
                   .filter(y -> comparator.compare(x, y) == 0)
                   .isPresent();
    }

    public Maybe<E> min() {
        return isEmpty() ? Maybe.empty() : Maybe.of(tree.head());
    }

    public Maybe<E> max() {
        return isEmpty() ? Maybe.empty() : Maybe.of(tree.last());
    }

    // Updates

    /**
     * Returns a set that also contains the given element. This set is
     * returned if the element is already present.
     */
    public OrderedSet<E> insert(E x) {
        requireNonNull(x);
        if (contains(x))
            return this;
        return with(tree.alter(merge().atLeast(x), found ->
            found.isPresent() ? ImmutableList.of(x, found.get()) : ImmutableList.of(x)));
    }

    /**
     * Returns a set without the given element. This set is returned if the
     * element is absent.
     */
    public OrderedSet<E> delete(E x) {
        requireNonNull(x);
        if (!contains(x))
            return this;
        return with(tree.alter(merge().atLeast(x), found -> ImmutableList.of()));
    }

    // Set algebra

    public OrderedSet<E> union(OrderedSet<E> other) {
        return with(merge().unionWith((x, y) -> x, tree, other.tree));
    }

    public OrderedSet<E> intersection(OrderedSet<E> other) {
        return with(merge().intersectionWith((x, y) -> x, tree, other.tree));
    }

    public OrderedSet<E> difference(OrderedSet<E> other) {
        return with(merge().differenceWith((x, y) -> Maybe.empty(), tree, other.tree));
    }

    public boolean isDisjointFrom(OrderedSet<E> other) {
        return merge().areDisjoint(tree, other.tree);
    }

    public boolean isSubsetOf(OrderedSet<E> other) {
        return merge().isSubsetOfWith(SizeMax::size, (x, y) -> true, tree, other.tree);
    }

    // Foldable

    @Override
    public <R> R foldLeft(R z, BiFunction<R, ? super E, R> f) {
        return tree.foldLeft(z, f);
    }

    @Override
    public <R> R foldRight(R z, BiFunction<? super E, R, R> f) {
        return tree.foldRight(z, f);
    }

    /**
     * Two sets are equal if they are ordered by equal comparators and hold
     * elements that pairwise compare as equal. Sets ordered by different
     * comparators are never equal.
     */
    @Override
    @SuppressWarnings("unchecked")
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof OrderedSet))
            return false;

        OrderedSet<E> other = (OrderedSet<E>)obj;
        if (size() != other.size() || !comparator.equals(other.comparator))
            return false;
        Iterator<E> it = other.iterator();
        try {
            for (E x : this) {
                if (comparator.compare(x, it.next()) != 0)
                    return false;
            }
            return true;
        } catch (ClassCastException ex) {
            return false;
        }
    }

    /**
     * Returns the sum of the element hash codes. Like {@link java.util.TreeSet},
     * this agrees with {@link #equals} only when the comparator is consistent
     * with the elements' own {@code equals}.
     */
    @Override
    public int hashCode() {
        return foldLeft(0, (h, x) -> h + x.hashCode());
    }

    @Override
    public String toString() {
        return show(", ", "OrderedSet[", "]");
    }
}
