/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package net.fingerseq.data;

import java.util.Comparator;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

import static java.util.Objects.requireNonNull;

/**
 * Merge combinators for finger trees kept in strictly ascending key order
 * and measured with a {@link Max} of their keys.
 *
 * <p>Each combinator repeatedly takes the head of one tree and splits the
 * other tree at that key, then swaps the roles of the trees. Runs of
 * elements that don't interleave are moved as whole subtrees, so merging
 * trees of sizes m &lt;= n takes amortized O(m log(n/m + 1)) time.
 *
 * @param <V> the measure type of the trees
 * @param <A> the element type of the trees
 * @param <K> the key type
 */
public final class OrderedMerge<V, A, K> {
    private final Function<? super V, Max<K>> maxKey;
    private final Function<? super A, ? extends K> key;
    private final Comparator<? super K> comparator;

    /**
     * Construct merge combinators.
     *
     * @param maxKey projects the maximum key out of a measure
     * @param key projects the key out of an element
     * @param comparator the ordering of the keys
     */
    public OrderedMerge(Function<? super V, Max<K>> maxKey,
                        Function<? super A, ? extends K> key,
                        Comparator<? super K> comparator) {
        this.maxKey = requireNonNull(maxKey);
        this.key = requireNonNull(key);
        this.comparator = requireNonNull(comparator);
    }

    /**
     * Returns the predicate that turns true at the first element whose key
     * is not less than the given key.
     */
    public Predicate<V> atLeast(K k) {
        return v -> maxKey.apply(v).isAtLeast(k, comparator);
    }

    /**
     * Returns the predicate that turns true at the first element whose key
     * is not less than the key of the given element.
     */
    public Predicate<V> atLeastKeyOf(A a) {
        return atLeast(key.apply(a));
    }

    /**
     * Tests whether two elements have equal keys.
     */
    public boolean sameKey(A x, A y) {
        return comparator.compare(key.apply(x), key.apply(y)) == 0;
    }

    private boolean headHasKeyOf(FingerTree<V, A> t, A a) {
        return !t.isEmpty() && sameKey(t.head(), a);
    }

    /**
     * Merges two trees. Elements with equal keys are combined with the given
     * function, which receives the element from {@code xs} first.
     */
    public FingerTree<V, A> unionWith(BinaryOperator<A> f, FingerTree<V, A> xs, FingerTree<V, A> ys) {
        FingerTree<V, A> acc = xs.maker().empty();
        FingerTree<V, A> as = xs, bs = ys;
        boolean swapped = false;

        while (!bs.isEmpty()) {
            if (as.isEmpty()) {
                return acc.append(bs);
            }

            A b = bs.head();
            Pair<FingerTree<V, A>> halves = as.split(atLeastKeyOf(b));
            FingerTree<V, A> r = halves.second();
            acc = acc.append(halves.first());

            if (headHasKeyOf(r, b)) {
                A x = r.head();
                acc = acc.snoc(swapped ? f.apply(b, x) : f.apply(x, b));
                r = r.tail();
            } else {
                acc = acc.snoc(b);
            }

            as = bs.tail();
            bs = r;
            swapped = !swapped;
        }
        return acc.append(as);
    }

    /**
     * Keeps the keys present in both trees, combining the two elements with
     * the given function, which receives the element from {@code xs} first.
     */
    public FingerTree<V, A> intersectionWith(BinaryOperator<A> f, FingerTree<V, A> xs, FingerTree<V, A> ys) {
        FingerTree<V, A> acc = xs.maker().empty();
        FingerTree<V, A> as = xs, bs = ys;
        boolean swapped = false;

        while (!as.isEmpty() && !bs.isEmpty()) {
            A b = bs.head();
            FingerTree<V, A> r = as.dropUntil(atLeastKeyOf(b));

            if (headHasKeyOf(r, b)) {
                A x = r.head();
                acc = acc.snoc(swapped ? f.apply(b, x) : f.apply(x, b));
                r = r.tail();
            }

            as = bs.tail();
            bs = r;
            swapped = !swapped;
        }
        return acc;
    }

    /**
     * Removes from {@code xs} the keys present in {@code ys}. For a key in
     * both trees the function decides what remains of the element from
     * {@code xs}; nothing drops the key.
     */
    public FingerTree<V, A> differenceWith(BiFunction<? super A, ? super A, Maybe<A>> f,
                                           FingerTree<V, A> xs, FingerTree<V, A> ys) {
        FingerTree<V, A> acc = xs.maker().empty();
        FingerTree<V, A> as = xs, bs = ys;

        while (!as.isEmpty()) {
            bs = bs.dropUntil(atLeastKeyOf(as.head()));
            if (bs.isEmpty()) {
                break;
            }

            A b = bs.head();
            Pair<FingerTree<V, A>> halves = as.split(atLeastKeyOf(b));
            FingerTree<V, A> r = halves.second();
            acc = acc.append(halves.first());

            if (headHasKeyOf(r, b)) {
                Maybe<A> rest = f.apply(r.head(), b);
                if (rest.isPresent()) {
                    acc = acc.snoc(rest.get());
                }
                r = r.tail();
            }

            as = r;
            bs = bs.tail();
        }
        return acc.append(as);
    }

    /**
     * Tests whether two trees have no key in common.
     */
    public boolean areDisjoint(FingerTree<V, A> xs, FingerTree<V, A> ys) {
        FingerTree<V, A> as = xs, bs = ys;
        while (!as.isEmpty() && !bs.isEmpty()) {
            A b = bs.head();
            FingerTree<V, A> r = as.dropUntil(atLeastKeyOf(b));
            if (headHasKeyOf(r, b)) {
                return false;
            }
            as = bs.tail();
            bs = r;
        }
        return true;
    }

    /**
     * Tests whether every key of {@code xs} is in {@code ys} and every such
     * pair of elements satisfies the {@code covered} test.
     *
     * <p>The descent alternates between checking the sub side against the
     * head of the super side and the other way round. A side is abandoned
     * as soon as the remaining sub side is larger than the remaining super
     * side, as measured by the {@code size} projection.
     *
     * @param size projects a size out of a measure
     * @param covered tests an element of the sub side against the element
     * with the same key on the super side
     */
    public boolean isSubsetOfWith(ToIntFunction<? super V> size, BiPredicate<? super A, ? super A> covered,
                                  FingerTree<V, A> xs, FingerTree<V, A> ys) {
        FingerTree<V, A> sub = xs, sup = ys;
        boolean subLeads = true;

        while (!sub.isEmpty()) {
            if (sup.isEmpty() || size.applyAsInt(sub.measure()) > size.applyAsInt(sup.measure())) {
                return false;
            }

            if (subLeads) {
                // every element of sub before the head of sup is missing from sup
                A b = sup.head();
                Pair<FingerTree<V, A>> halves = sub.split(atLeastKeyOf(b));
                if (!halves.first().isEmpty()) {
                    return false;
                }
                FingerTree<V, A> r = halves.second();
                if (headHasKeyOf(r, b)) {
                    if (!covered.test(r.head(), b)) {
                        return false;
                    }
                    r = r.tail();
                }
                sub = r;
                sup = sup.tail();
            } else {
                // the head of sub must be matched by sup
                A x = sub.head();
                FingerTree<V, A> r = sup.dropUntil(atLeastKeyOf(x));
                if (!headHasKeyOf(r, x) || !covered.test(x, r.head())) {
                    return false;
                }
                sub = sub.tail();
                sup = r.tail();
            }
            subLeads = !subLeads;
        }
        return true;
    }
}
