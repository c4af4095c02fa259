/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package net.fingerseq.collect;

import java.util.Comparator;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.ObjIntConsumer;
import java.util.function.Predicate;

import com.google.common.collect.ImmutableList;

import net.fingerseq.data.FingerTree;
import net.fingerseq.data.Foldable;
import net.fingerseq.data.Maybe;
import net.fingerseq.data.OrderedMerge;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A persistent sorted multiset. Each distinct value is stored once with the
 * number of its occurrences, in ascending order of the multiset's
 * comparator.
 *
 * <p>Besides insertion, deletion and counting in logarithmic time, the
 * multiset answers order statistics (the k-th smallest or largest element,
 * counting or ignoring repetitions) in logarithmic time and supports
 * union, intersection and difference with multiplicity arithmetic.
 *
 * <p>Values that compare as equal are treated as the same value; the
 * value first inserted is the one kept. Null values are not permitted.
 *
 * @param <T> the value type
 */
public final class MultiSet<T> implements Foldable<T> {
    private final Comparator<? super T> comparator;
    private final FingerTree<MultiMeasure<T>, MultiElem<T>> tree;

    private MultiSet(Comparator<? super T> comparator, FingerTree<MultiMeasure<T>, MultiElem<T>> tree) {
        this.comparator = comparator;
        this.tree = tree;
    }

    private MultiSet<T> with(FingerTree<MultiMeasure<T>, MultiElem<T>> t) {
        return t == tree ? this : new MultiSet<>(comparator, t);
    }

    private OrderedMerge<MultiMeasure<T>, MultiElem<T>, T> merge() {
        return new OrderedMerge<>(MultiMeasure::max, e -> e.value, comparator);
    }

    private Predicate<MultiMeasure<T>> atLeast(T x) {
        return v -> v.max.isAtLeast(x, comparator);
    }

    private boolean sameValue(T x, MultiElem<T> e) {
        return comparator.compare(x, e.value) == 0;
    }

    // Construction

    public static <T extends Comparable<? super T>> MultiSet<T> empty() {
        return empty(Comparator.naturalOrder());
    }

    public static <T> MultiSet<T> empty(Comparator<? super T> c) {
        return new MultiSet<>(requireNonNull(c), MultiElem.<T>maker().empty());
    }

    public static <T extends Comparable<? super T>> MultiSet<T> singleton(T x) {
        return singleton(Comparator.naturalOrder(), x);
    }

    public static <T> MultiSet<T> singleton(Comparator<? super T> c, T x) {
        return new MultiSet<>(requireNonNull(c), MultiElem.<T>maker().singleton(MultiElem.of(x)));
    }

    @SafeVarargs
    public static <T extends Comparable<? super T>> MultiSet<T> of(T... xs) {
        return fromList(ImmutableList.copyOf(xs));
    }

    /**
     * Builds a multiset from values in any order by repeated insertion.
     */
    public static <T extends Comparable<? super T>> MultiSet<T> fromList(Iterable<? extends T> xs) {
        return fromList(Comparator.naturalOrder(), xs);
    }

    public static <T> MultiSet<T> fromList(Comparator<? super T> c, Iterable<? extends T> xs) {
        MultiSet<T> s = empty(c);
        for (T x : xs) {
            s = s.insert(x);
        }
        return s;
    }

    /**
     * Builds a multiset in linear time from values in ascending order,
     * repetitions allowed. The order is not verified unless invariant checks
     * are enabled.
     *
     * @throws IllegalArgumentException if invariant checks are enabled and
     * the values are not in ascending order
     */
    public static <T extends Comparable<? super T>> MultiSet<T> fromAscList(Iterable<? extends T> xs) {
        return fromAscList(Comparator.naturalOrder(), xs);
    }

    public static <T> MultiSet<T> fromAscList(Comparator<? super T> c, Iterable<? extends T> xs) {
        requireNonNull(c);
        boolean check = InvariantChecks.enabled();
        FingerTree<MultiMeasure<T>, MultiElem<T>> t = MultiElem.<T>maker().empty();
        for (T x : xs) {
            requireNonNull(x);
            if (t.isEmpty()) {
                t = t.snoc(MultiElem.of(x));
                continue;
            }
            MultiElem<T> last = t.last();
            if (check) {
                InvariantChecks.checkAscending(c, last.value, x, false, "fromAscList");
            }
            if (c.compare(last.value, x) == 0) {
                t = t.init().snoc(last.increment());
            } else {
                t = t.snoc(MultiElem.of(x));
            }
        }
        return new MultiSet<>(c, t);
    }

    /**
     * Builds a multiset in linear time from values in descending order,
     * repetitions allowed. The order is not verified unless invariant checks
     * are enabled.
     *
     * @throws IllegalArgumentException if invariant checks are enabled and
     * the values are not in descending order
     */
    public static <T extends Comparable<? super T>> MultiSet<T> fromDescList(Iterable<? extends T> xs) {
        return fromDescList(Comparator.naturalOrder(), xs);
    }

    public static <T> MultiSet<T> fromDescList(Comparator<? super T> c, Iterable<? extends T> xs) {
        requireNonNull(c);
        boolean check = InvariantChecks.enabled();
        FingerTree<MultiMeasure<T>, MultiElem<T>> t = MultiElem.<T>maker().empty();
        for (T x : xs) {
            requireNonNull(x);
            if (t.isEmpty()) {
                t = t.cons(MultiElem.of(x));
                continue;
            }
            MultiElem<T> first = t.head();
            if (check) {
                InvariantChecks.checkAscending(c, x, first.value, false, "fromDescList");
            }
            if (c.compare(first.value, x) == 0) {
                t = t.tail().cons(first.increment());
            } else {
                t = t.cons(MultiElem.of(x));
            }
        }
        return new MultiSet<>(c, t);
    }

    /**
     * Builds a multiset in linear time from distinct values in ascending
     * order. The order is not verified unless invariant checks are enabled.
     *
     * @throws IllegalArgumentException if invariant checks are enabled and
     * the values are not strictly ascending
     */
    public static <T extends Comparable<? super T>> MultiSet<T> fromDistinctAscList(Iterable<? extends T> xs) {
        return fromDistinctAscList(Comparator.naturalOrder(), xs);
    }

    public static <T> MultiSet<T> fromDistinctAscList(Comparator<? super T> c, Iterable<? extends T> xs) {
        requireNonNull(c);
        boolean check = InvariantChecks.enabled();
        FingerTree<MultiMeasure<T>, MultiElem<T>> t = MultiElem.<T>maker().empty();
        for (T x : xs) {
            if (check && !t.isEmpty()) {
                InvariantChecks.checkAscending(c, t.last().value, x, true, "fromDistinctAscList");
            }
            t = t.snoc(MultiElem.of(x));
        }
        return new MultiSet<>(c, t);
    }

    /**
     * Builds a multiset in linear time from distinct values in descending
     * order. The order is not verified unless invariant checks are enabled.
     *
     * @throws IllegalArgumentException if invariant checks are enabled and
     * the values are not strictly descending
     */
    public static <T extends Comparable<? super T>> MultiSet<T> fromDistinctDescList(Iterable<? extends T> xs) {
        return fromDistinctDescList(Comparator.naturalOrder(), xs);
    }

    public static <T> MultiSet<T> fromDistinctDescList(Comparator<? super T> c, Iterable<? extends T> xs) {
        requireNonNull(c);
        boolean check = InvariantChecks.enabled();
        FingerTree<MultiMeasure<T>, MultiElem<T>> t = MultiElem.<T>maker().empty();
        for (T x : xs) {
            if (check && !t.isEmpty()) {
                InvariantChecks.checkAscending(c, x, t.head().value, true, "fromDistinctDescList");
            }
            t = t.cons(MultiElem.of(x));
        }
        return new MultiSet<>(c, t);
    }

    // Queries

    public boolean isEmpty() {
        return tree.isEmpty();
    }

    /**
     * Returns the total number of occurrences, in constant time. Sizes and
     * multiplicities are bounded by {@code Integer.MAX_VALUE}; updates that
     * would exceed it throw {@code ArithmeticException}.
     */
    public int size() {
        return tree.measure().cardinality;
    }

    /**
     * Returns the number of distinct values, in constant time.
     */
    public int uniqueCount() {
        return tree.measure().supportSize;
    }

    public Comparator<? super T> comparator() {
        return comparator;
    }

    private Maybe<MultiElem<T>> find(T x) {
        requireNonNull(x);
        return tree.lookup(atLeast(x)).filter(e -> sameValue(x, e));
    }

    /**
     * Returns the number of occurrences of the given value.
     */
    public int count(T x) {
        return find(x).map(e -> e.multiplicity).orElse(0);
    }

    public boolean contains(T x) {
        return find(x).isPresent();
    }

    // Updates

    /**
     * Returns a multiset with one more occurrence of the given value.
     *
     * @throws ArithmeticException if the number of occurrences overflows
     */
    public MultiSet<T> insert(T x) {
        return insert(x, 1);
    }

    /**
     * Returns a multiset with the given number of additional occurrences of
     * the given value.
     *
     * @throws IllegalArgumentException if {@code occurrences} is negative
     * @throws ArithmeticException if the number of occurrences overflows
     */
    public MultiSet<T> insert(T x, int occurrences) {
        requireNonNull(x);
        checkArgument(occurrences >= 0, "occurrences cannot be negative: %s", occurrences);
        if (occurrences == 0)
            return this;

        MultiElem<T> added = MultiElem.of(x).setMultiplicity(occurrences);
        return with(tree.alter(atLeast(x), found -> {
            if (found.isAbsent()) {
                return ImmutableList.of(added);
            } else if (sameValue(x, found.get())) {
                return ImmutableList.of(found.get().add(occurrences));
            } else {
                return ImmutableList.of(added, found.get());
            }
        }));
    }

    /**
     * Returns a multiset with one occurrence of the given value removed.
     * This multiset is returned if the value is absent.
     */
    public MultiSet<T> deleteOnce(T x) {
        if (!contains(x))
            return this;
        return with(tree.alter(atLeast(x), found -> found.get().decrement()));
    }

    /**
     * Returns a multiset with every occurrence of the given value removed.
     * This multiset is returned if the value is absent.
     */
    public MultiSet<T> deleteAll(T x) {
        if (!contains(x))
            return this;
        return with(tree.alter(atLeast(x), found -> ImmutableList.of()));
    }

    // Mapping

    /**
     * Applies a function to every occurrence and collects the results in a
     * multiset ordered by natural ordering. Values mapped to equal results
     * are merged.
     */
    public <R extends Comparable<? super R>> MultiSet<R> map(Function<? super T, ? extends R> f) {
        return map(f, Comparator.naturalOrder());
    }

    public <R> MultiSet<R> map(Function<? super T, ? extends R> f, Comparator<? super R> c) {
        requireNonNull(f);
        MultiSet<R> result = empty(c);
        for (MultiElem<T> e : tree) {
            result = result.insert(f.apply(e.value), e.multiplicity);
        }
        return result;
    }

    /**
     * Applies a strictly increasing function to every value, in linear
     * time, keeping the multiplicities. The function is trusted to preserve
     * the order unless invariant checks are enabled.
     *
     * @throws IllegalArgumentException if invariant checks are enabled and
     * the function does not preserve the order
     */
    public <R extends Comparable<? super R>> MultiSet<R> mapMonotonic(Function<? super T, ? extends R> f) {
        return mapMonotonic(f, Comparator.naturalOrder());
    }

    public <R> MultiSet<R> mapMonotonic(Function<? super T, ? extends R> f, Comparator<? super R> c) {
        requireNonNull(f);
        requireNonNull(c);
        FingerTree<MultiMeasure<R>, MultiElem<R>> t = tree.map(e -> e.mapValue(f), MultiElem.<R>maker());
        if (InvariantChecks.enabled()) {
            t.foldLeft(null, (R prev, MultiElem<R> e) -> {
                if (prev != null)
                    InvariantChecks.checkAscending(c, prev, e.value, true, "mapMonotonic");
                return e.value;
            });
        }
        return new MultiSet<>(c, t);
    }

    // Order statistics

    public Maybe<T> smallestElem() {
        return isEmpty() ? Maybe.empty() : Maybe.of(tree.head().value);
    }

    public Maybe<T> largestElem() {
        return isEmpty() ? Maybe.empty() : Maybe.of(tree.last().value);
    }

    /**
     * Returns the k-th smallest occurrence, counting from 1 and counting
     * each repetition.
     *
     * @return the value, or nothing if {@code k} is out of range
     */
    public Maybe<T> kthSmallestElem(int k) {
        if (k < 1 || k > size())
            return Maybe.empty();
        return tree.lookup(v -> v.cardinality >= k).map(e -> e.value);
    }

    /**
     * Returns the k-th smallest distinct value, counting from 1.
     *
     * @return the value, or nothing if {@code k} is out of range
     */
    public Maybe<T> kthSmallestUniqueElem(int k) {
        if (k < 1 || k > uniqueCount())
            return Maybe.empty();
        return tree.lookup(v -> v.supportSize >= k).map(e -> e.value);
    }

    /**
     * Returns the k-th largest occurrence, counting from 1 and counting
     * each repetition.
     */
    public Maybe<T> kthLargestElem(int k) {
        if (k < 1 || k > size())
            return Maybe.empty();
        return kthSmallestElem(size() - k + 1);
    }

    /**
     * Returns the k-th largest distinct value, counting from 1.
     */
    public Maybe<T> kthLargestUniqueElem(int k) {
        if (k < 1 || k > uniqueCount())
            return Maybe.empty();
        return kthSmallestUniqueElem(uniqueCount() - k + 1);
    }

    // Multiset algebra

    /**
     * Returns the multiset in which each value occurs as often as in both
     * multisets together.
     *
     * @throws ArithmeticException if a number of occurrences overflows
     */
    public MultiSet<T> union(MultiSet<T> other) {
        return with(merge().unionWith(MultiElem::sum, tree, other.tree));
    }

    /**
     * Returns the multiset in which each value occurs as often as in the
     * multiset where it occurs least.
     */
    public MultiSet<T> intersection(MultiSet<T> other) {
        return with(merge().intersectionWith(MultiElem::min, tree, other.tree));
    }

    /**
     * Returns the multiset in which each value occurs as often as in this
     * multiset less its occurrences in the other, if that is positive.
     */
    public MultiSet<T> difference(MultiSet<T> other) {
        return with(merge().differenceWith(MultiElem::difference, tree, other.tree));
    }

    public boolean isDisjointFrom(MultiSet<T> other) {
        return merge().areDisjoint(tree, other.tree);
    }

    /**
     * Tests whether every value occurs in the other multiset at least as
     * often as in this one.
     */
    public boolean isSubsetOf(MultiSet<T> other) {
        return merge().isSubsetOfWith(MultiMeasure::cardinality,
                                      (x, y) -> x.multiplicity <= y.multiplicity,
                                      tree, other.tree);
    }

    public boolean isSupsetOf(MultiSet<T> other) {
        return other.isSubsetOf(this);
    }

    /**
     * Returns the set of distinct values.
     */
    public OrderedSet<T> support() {
        ImmutableList.Builder<T> values = ImmutableList.builder();
        for (MultiElem<T> e : tree) {
            values.add(e.value);
        }
        return OrderedSet.fromDistinctAscList(comparator, values.build());
    }

    /**
     * Performs the given action for each distinct value with its number of
     * occurrences, in ascending order.
     */
    public void forEachEntry(ObjIntConsumer<? super T> action) {
        requireNonNull(action);
        for (MultiElem<T> e : tree) {
            action.accept(e.value, e.multiplicity);
        }
    }

    // Foldable

    @Override
    public <R> R foldLeft(R z, BiFunction<R, ? super T, R> f) {
        return tree.foldLeft(z, (r, e) -> e.foldLeft(r, f));
    }

    @Override
    public <R> R foldRight(R z, BiFunction<? super T, R, R> f) {
        return tree.foldRight(z, (e, r) -> e.foldRight(r, f));
    }

    /**
     * Two multisets are equal if they are ordered by equal comparators and
     * every value occurs equally often in both. Multisets ordered by
     * different comparators are never equal.
     */
    @Override
    @SuppressWarnings("unchecked")
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof MultiSet))
            return false;

        MultiSet<T> other = (MultiSet<T>)obj;
        if (size() != other.size() || uniqueCount() != other.uniqueCount())
            return false;
        if (!comparator.equals(other.comparator))
            return false;
        try {
            return isSubsetOf(other) && other.isSubsetOf(this);
        } catch (ClassCastException ex) {
            return false;
        }
    }

    /**
     * Like {@link java.util.TreeSet}, the hash code agrees with
     * {@link #equals} only when the comparator is consistent with the
     * values' own {@code equals}.
     */
    @Override
    public int hashCode() {
        return tree.foldLeft(0, (h, e) -> h + (e.value.hashCode() ^ e.multiplicity));
    }

    @Override
    public String toString() {
        return show(", ", "MultiSet[", "]");
    }
}
