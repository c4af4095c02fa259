/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package net.fingerseq.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import net.fingerseq.function.TriFunction;

final class FingerTreeImpl {
    private FingerTreeImpl() {}

    /**
     * Things that can be measured.
     */
    interface Measured<V> {
        V measure();
    }

    static abstract class FTMaker<V,A> implements FingerTree.Maker<V,A> {
        private final FTree<V,A> empty = new Empty<>(this);

        @Override
        public final FTree<V,A> empty() {
            return empty;
        }

        @Override
        public final FTree<V,A> singleton(A value) {
            return new Single<>(this, value);
        }

        final V sum(Measured<V> a, Measured<V> b) {
            return sum(a.measure(), b.measure());
        }

        final V sum(Measured<V> a, Measured<V> b, Measured<V> c) {
            return sum(sum(a.measure(), b.measure()), c.measure());
        }

        @SuppressWarnings("unchecked")
        final V measureAll(Object[] items) {
            V v = measure((A)items[0]);
            for (int i = 1; i < items.length; i++) {
                v = sum(v, measure((A)items[i]));
            }
            return v;
        }

        // Factory methods

        final FTree<V,A> deep(V v, Digit<V,A> pr, FTree<V, Node<V,A>> mi, Digit<V,A> sf) {
            return new Deep<>(this, v, pr, mi, sf);
        }

        final FTree<V,A> deep(Digit<V,A> pr, FTree<V, Node<V,A>> mi, Digit<V,A> sf) {
            return new Deep<>(this, sum(pr, mi, sf), pr, mi, sf);
        }

        final FTree<V,A> pullL(FTree<V, Node<V,A>> mi, Digit<V,A> sf) {
            return mi.isEmpty()
                 ? sf.toTree()
                 : deep(sum(mi, sf), mi.head().toDigit(), mi.tail(), sf);
        }

        final FTree<V,A> pullR(Digit<V,A> pr, FTree<V, Node<V,A>> mi) {
            return mi.isEmpty()
                 ? pr.toTree()
                 : deep(sum(pr, mi), pr, mi.init(), mi.last().toDigit());
        }

        final FTree<V,A> deepL(Digit<V,A> pr, FTree<V, Node<V,A>> mi, Digit<V,A> sf) {
            return pr == null ? pullL(mi, sf) : deep(pr, mi, sf);
        }

        final FTree<V,A> deepR(Digit<V,A> pr, FTree<V, Node<V,A>> mi, Digit<V,A> sf) {
            return sf == null ? pullR(pr, mi) : deep(pr, mi, sf);
        }

        final Digit<V,A> digit(Object... items) {
            return new Digit<>(this, items);
        }

        /**
         * Returns a digit holding the given range of items, or null if the
         * range is empty.
         */
        final Digit<V,A> digit(Object[] items, int from, int to) {
            return from == to ? null : new Digit<>(this, Arrays.copyOfRange(items, from, to));
        }

        final Node<V,A> node(Object... items) {
            return new Node<>(this, measureAll(items), items);
        }

        private FTMaker<V, Node<V,A>> nm;

        final FTMaker<V, Node<V,A>> nodeMaker() {
            FTMaker<V, Node<V,A>> nm;
            if ((nm = this.nm) == null)
                nm = this.nm = new NodeMaker<>(this);
            return nm;
        }
    }

    static class MonoidMaker<V,A> extends FTMaker<V,A> {
        private final Monoid<V> monoid;
        private final Function<? super A, ? extends V> measure;

        MonoidMaker(Monoid<V> monoid, Function<? super A, ? extends V> measure) {
            this.monoid = monoid;
            this.measure = measure;
        }

        @Override
        public V zero() {
            return monoid.empty();
        }

        @Override
        public V sum(V v1, V v2) {
            return monoid.append(v1, v2);
        }

        @Override
        public V measure(A a) {
            return measure.apply(a);
        }
    }

    static class NodeMaker<V,A> extends FTMaker<V, Node<V,A>> {
        private final FTMaker<V,A> delegate;

        NodeMaker(FTMaker<V,A> delegate) {
            this.delegate = delegate;
        }

        @Override
        public V zero() {
            return delegate.zero();
        }

        @Override
        public V sum(V v1, V v2) {
            return delegate.sum(v1, v2);
        }

        @Override
        public V measure(Node<V,A> node) {
            return node.measure();
        }
    }

    /**
     * An intermediate measurement lookup result.
     */
    static final class Place<V, A> {
        final V measure;
        final A result;

        Place(V v, A a) {
            measure = v;
            result = a;
        }
    }

    /**
     * A tree splitting result.
     */
    static final class Split<T, A> {
        final T left;
        final A value;
        final T right;

        Split(T left, A value, T right) {
            this.left = left;
            this.value = value;
            this.right = right;
        }

        <R> R as(TriFunction<T, A, T, R> f) {
            return f.apply(left, value, right);
        }
    }

    /**
     * A short run of 1-4 items. Digits and nodes share the searching logic,
     * they only differ in how they are measured.
     */
    static abstract class Chunk<V,A> implements Foldable<A>, Measured<V> {
        final FTMaker<V,A> m;
        final Object[] items;

        Chunk(FTMaker<V,A> m, Object[] items) {
            this.m = m;
            this.items = items;
        }

        final int size() {
            return items.length;
        }

        @SuppressWarnings("unchecked")
        final A get(int i) {
            return (A)items[i];
        }

        /**
         * Returns the index of the item at which the predicate turns true,
         * starting from the accumulated measure {@code v}. The last item is
         * returned when the predicate never turns true within this chunk.
         * The accumulated measure before that item is stored in {@code acc[0]}.
         */
        final int locate(Predicate<? super V> p, V v, Object[] acc) {
            int last = items.length - 1, i = 0;
            for (; i < last; i++) {
                V vi = m.sum(v, m.measure(get(i)));
                if (p.test(vi))
                    break;
                v = vi;
            }
            acc[0] = v;
            return i;
        }

        @SuppressWarnings("unchecked")
        final Place<V,A> lookup(Predicate<? super V> p, V v) {
            Object[] acc = new Object[1];
            int i = locate(p, v, acc);
            return new Place<>((V)acc[0], get(i));
        }

        @SuppressWarnings("unchecked")
        final Object[] modifyItems(Predicate<? super V> p, V v, BiFunction<V,A,A> f) {
            Object[] acc = new Object[1];
            int i = locate(p, v, acc);
            Object[] xs = items.clone();
            xs[i] = f.apply((V)acc[0], get(i));
            return xs;
        }

        final Split<Digit<V,A>,A> split(Predicate<? super V> p, V v) {
            int i = locate(p, v, new Object[1]);
            return new Split<>(m.digit(items, 0, i), get(i), m.digit(items, i + 1, items.length));
        }

        final Object[] mapItems(Function<? super A, ?> f) {
            Object[] xs = new Object[items.length];
            for (int i = 0; i < items.length; i++) {
                xs[i] = f.apply(get(i));
            }
            return xs;
        }

        final Object[] reverseItems(UnaryOperator<A> f) {
            int n = items.length;
            Object[] xs = new Object[n];
            for (int i = 0; i < n; i++) {
                xs[n - 1 - i] = f.apply(get(i));
            }
            return xs;
        }

        @Override
        public <R> R foldLeft(R z, BiFunction<R, ? super A, R> f) {
            for (int i = 0; i < items.length; i++) {
                z = f.apply(z, get(i));
            }
            return z;
        }

        @Override
        public <R> R foldRight(R z, BiFunction<? super A, R, R> f) {
            for (int i = items.length; --i >= 0; ) {
                z = f.apply(get(i), z);
            }
            return z;
        }
    }

    /**
     * A digit is a vector of 1-4 elements. Serves as a pointer to the
     * prefix or suffix of a finger tree.
     */
    static final class Digit<V,A> extends Chunk<V,A> {
        Digit(FTMaker<V,A> m, Object[] items) {
            super(m, items);
        }

        @Override
        public V measure() {
            return m.measureAll(items);
        }

        A first() {
            return get(0);
        }

        A last() {
            return get(items.length - 1);
        }

        boolean isFull() {
            return items.length == 4;
        }

        Digit<V,A> cons(A a) {
            Object[] xs = new Object[items.length + 1];
            xs[0] = a;
            System.arraycopy(items, 0, xs, 1, items.length);
            return new Digit<>(m, xs);
        }

        Digit<V,A> snoc(A a) {
            Object[] xs = Arrays.copyOf(items, items.length + 1);
            xs[items.length] = a;
            return new Digit<>(m, xs);
        }

        Digit<V,A> dropFirst() {
            return m.digit(items, 1, items.length);
        }

        Digit<V,A> dropLast() {
            return m.digit(items, 0, items.length - 1);
        }

        Digit<V,A> modify(Predicate<? super V> p, V v, BiFunction<V,A,A> f) {
            return new Digit<>(m, modifyItems(p, v, f));
        }

        <W,B> Digit<W,B> map(Function<? super A, ? extends B> f, FTMaker<W,B> mb) {
            return new Digit<>(mb, mapItems(f));
        }

        Digit<V,A> reverse(UnaryOperator<A> f) {
            return new Digit<>(m, reverseItems(f));
        }

        FTree<V,A> toTree() {
            return foldLeft(m.empty(), FTree::snoc);
        }
    }

    /**
     * A node holds 2 or 3 elements and caches their measure.
     */
    static final class Node<V,A> extends Chunk<V,A> {
        final V v;

        Node(FTMaker<V,A> m, V v, Object[] items) {
            super(m, items);
            this.v = v;
        }

        @Override
        public V measure() {
            return v;
        }

        Node<V,A> modify(Predicate<? super V> p, V v, BiFunction<V,A,A> f) {
            return new Node<>(m, this.v, modifyItems(p, v, f));
        }

        <W,B> Node<W,B> map(Function<? super A, ? extends B> f, FTMaker<W,B> mb) {
            return mb.node(mapItems(f));
        }

        Node<V,A> reverse(UnaryOperator<A> f) {
            return m.node(reverseItems(f));
        }

        Digit<V,A> toDigit() {
            return new Digit<>(m, items);
        }
    }

    // ------------------------------------------------------------------------

    static abstract class FTree<V,A> implements FingerTree<V,A>, Measured<V> {
        final FTMaker<V,A> m;

        FTree(FTMaker<V,A> m) {
            this.m = m;
        }

        @Override
        public FingerTree.Maker<V,A> maker() {
            return m;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override public abstract FTree<V,A> tail();
        @Override public abstract FTree<V,A> init();
        @Override public abstract FTree<V,A> cons(A a);
        @Override public abstract FTree<V,A> snoc(A a);

        @Override
        public Maybe<A> lookup(Predicate<? super V> p) {
            if (isEmpty() || !p.test(measure())) {
                return Maybe.empty();
            } else {
                return Maybe.of(lookupTree(p, m.zero()).result);
            }
        }

        @Override
        public FingerTree<V,A> modify(Predicate<? super V> p, UnaryOperator<A> f) {
            if (isEmpty() || !p.test(measure())) {
                return this;
            } else {
                return modifyTree(p, m.zero(), (v, x) -> f.apply(x));
            }
        }

        @Override
        public Pair<FingerTree<V,A>> split(Predicate<? super V> p) {
            if (isEmpty()) {
                return Tuple.pair(this, this);
            } else if (p.test(measure())) {
                return splitTree(p, m.zero()).as((l, x, r) -> Tuple.pair(l, r.cons(x)));
            } else {
                return Tuple.pair(this, m.empty());
            }
        }

        @Override
        public FingerTree<V,A> append(FingerTree<V,A> that) {
            return concat(this, new ArrayList<>(), (FTree<V,A>)that);
        }

        @Override
        public <W,B> FingerTree<W,B> map(Function<? super A, ? extends B> f, FingerTree.Maker<W,B> mb) {
            return mapTree(f, (FTMaker<W,B>)mb);
        }

        @Override
        public FTree<V,A> reverse() {
            return reverseTree(UnaryOperator.identity());
        }

        abstract Place<V,A> lookupTree(Predicate<? super V> p, V v);
        abstract FTree<V,A> modifyTree(Predicate<? super V> p, V v, BiFunction<V,A,A> f);
        abstract Split<FTree<V,A>,A> splitTree(Predicate<? super V> p, V v);
        abstract <W,B> FTree<W,B> mapTree(Function<? super A, ? extends B> f, FTMaker<W,B> mb);
        abstract FTree<V,A> reverseTree(UnaryOperator<A> f);

        public String toString() {
            return show(", ", "FingerTree[", "]");
        }
    }

    static final class Empty<V,A> extends FTree<V,A> {
        Empty(FTMaker<V,A> m) {
            super(m);
        }

        @Override
        public boolean isEmpty() {
            return true;
        }

        @Override
        public V measure() {
            return m.zero();
        }

        @Override
        public A head() {
            throw new NoSuchElementException();
        }

        @Override
        public A last() {
            throw new NoSuchElementException();
        }

        @Override
        public FTree<V,A> tail() {
            throw new NoSuchElementException();
        }

        @Override
        public FTree<V,A> init() {
            throw new NoSuchElementException();
        }

        @Override
        public FTree<V,A> cons(A a) {
            return m.singleton(a);
        }

        @Override
        public FTree<V,A> snoc(A a) {
            return m.singleton(a);
        }

        @Override
        Place<V,A> lookupTree(Predicate<? super V> p, V v) {
            throw new NoSuchElementException();
        }

        @Override
        FTree<V,A> modifyTree(Predicate<? super V> p, V v, BiFunction<V,A,A> f) {
            throw new NoSuchElementException();
        }

        @Override
        Split<FTree<V,A>,A> splitTree(Predicate<? super V> p, V v) {
            throw new NoSuchElementException();
        }

        @Override
        <W,B> FTree<W,B> mapTree(Function<? super A, ? extends B> f, FTMaker<W,B> mb) {
            return mb.empty();
        }

        @Override
        FTree<V,A> reverseTree(UnaryOperator<A> f) {
            return this;
        }

        @Override
        public <R> R foldLeft(R z, BiFunction<R, ? super A, R> f) {
            return z;
        }

        @Override
        public <R> R foldRight(R z, BiFunction<? super A, R, R> f) {
            return z;
        }
    }

    static final class Single<V,A> extends FTree<V,A> {
        final A a;

        Single(FTMaker<V,A> m, A a) {
            super(m);
            this.a = a;
        }

        @Override
        public V measure() {
            return m.measure(a);
        }

        @Override
        public A head() {
            return a;
        }

        @Override
        public A last() {
            return a;
        }

        @Override
        public FTree<V,A> tail() {
            return m.empty();
        }

        @Override
        public FTree<V,A> init() {
            return m.empty();
        }

        @Override
        public FTree<V,A> cons(A b) {
            return m.deep(m.digit(b), m.nodeMaker().empty(), m.digit(a));
        }

        @Override
        public FTree<V,A> snoc(A b) {
            return m.deep(m.digit(a), m.nodeMaker().empty(), m.digit(b));
        }

        @Override
        Place<V,A> lookupTree(Predicate<? super V> p, V v) {
            return new Place<>(v, a);
        }

        @Override
        FTree<V,A> modifyTree(Predicate<? super V> p, V v, BiFunction<V,A,A> f) {
            return m.singleton(f.apply(v, a));
        }

        @Override
        Split<FTree<V,A>,A> splitTree(Predicate<? super V> p, V v) {
            return new Split<>(m.empty(), a, m.empty());
        }

        @Override
        <W,B> FTree<W,B> mapTree(Function<? super A, ? extends B> f, FTMaker<W,B> mb) {
            return mb.singleton(f.apply(a));
        }

        @Override
        FTree<V,A> reverseTree(UnaryOperator<A> f) {
            return m.singleton(f.apply(a));
        }

        @Override
        public <R> R foldLeft(R z, BiFunction<R, ? super A, R> f) {
            return f.apply(z, a);
        }

        @Override
        public <R> R foldRight(R z, BiFunction<? super A, R, R> f) {
            return f.apply(a, z);
        }
    }

    static final class Deep<V,A> extends FTree<V,A> {
        final V v;
        final Digit<V,A> pr;
        final FTree<V, Node<V,A>> mi;
        final Digit<V,A> sf;

        Deep(FTMaker<V,A> m, V v, Digit<V,A> pr, FTree<V, Node<V,A>> mi, Digit<V,A> sf) {
            super(m);
            this.v = v;
            this.pr = pr;
            this.mi = mi;
            this.sf = sf;
        }

        @Override
        public V measure() {
            return v;
        }

        @Override
        public A head() {
            return pr.first();
        }

        @Override
        public A last() {
            return sf.last();
        }

        @Override
        public FTree<V,A> tail() {
            return m.deepL(pr.dropFirst(), mi, sf);
        }

        @Override
        public FTree<V,A> init() {
            return m.deepR(pr, mi, sf.dropLast());
        }

        @Override
        public FTree<V,A> cons(A a) {
            V v = m.sum(m.measure(a), this.v);
            if (!pr.isFull()) {
                return m.deep(v, pr.cons(a), mi, sf);
            } else {
                Node<V,A> n = m.node(pr.get(1), pr.get(2), pr.get(3));
                return m.deep(v, m.digit(a, pr.get(0)), mi.cons(n), sf);
            }
        }

        @Override
        public FTree<V,A> snoc(A z) {
            V v = m.sum(this.v, m.measure(z));
            if (!sf.isFull()) {
                return m.deep(v, pr, mi, sf.snoc(z));
            } else {
                Node<V,A> n = m.node(sf.get(0), sf.get(1), sf.get(2));
                return m.deep(v, pr, mi.snoc(n), m.digit(sf.get(3), z));
            }
        }

        @Override
        Place<V,A> lookupTree(Predicate<? super V> p, V v) {
            V vpr = m.sum(v, pr.measure());
            V vm = m.sum(vpr, mi.measure());
            if (p.test(vpr)) {
                return pr.lookup(p, v);
            } else if (p.test(vm)) {
                Place<V, Node<V,A>> np = mi.lookupTree(p, vpr);
                return np.result.lookup(p, np.measure);
            } else {
                return sf.lookup(p, vm);
            }
        }

        @Override
        FTree<V,A> modifyTree(Predicate<? super V> p, V v, BiFunction<V,A,A> f) {
            V vpr = m.sum(v, pr.measure());
            V vm = m.sum(vpr, mi.measure());
            if (p.test(vpr)) {
                return m.deep(this.v, pr.modify(p, v, f), mi, sf);
            } else if (p.test(vm)) {
                return m.deep(this.v, pr, mi.modifyTree(p, vpr, (w, n) -> n.modify(p, w, f)), sf);
            } else {
                return m.deep(this.v, pr, mi, sf.modify(p, vm, f));
            }
        }

        @Override
        Split<FTree<V,A>,A> splitTree(Predicate<? super V> p, V v) {
            V vpr = m.sum(v, pr.measure());
            V vm = m.sum(vpr, mi.measure());
            if (p.test(vpr)) {
                return pr.split(p, v).as((l, x, r) ->
                    new Split<>(l != null ? l.toTree() : m.empty(), x, m.deepL(r, mi, sf)));
            } else if (p.test(vm)) {
                return mi.splitTree(p, vpr).as((ml, mx, mr) ->
                    mx.split(p, m.sum(vpr, ml.measure())).as((l, x, r) ->
                      new Split<>(m.deepR(pr, ml, l), x, m.deepL(r, mr, sf))));
            } else {
                return sf.split(p, vm).as((l, x, r) ->
                    new Split<>(m.deepR(pr, mi, l), x, r != null ? r.toTree() : m.empty()));
            }
        }

        @Override
        <W,B> FTree<W,B> mapTree(Function<? super A, ? extends B> f, FTMaker<W,B> mb) {
            return mb.deep(pr.map(f, mb), mi.mapTree(n -> n.map(f, mb), mb.nodeMaker()), sf.map(f, mb));
        }

        @Override
        FTree<V,A> reverseTree(UnaryOperator<A> f) {
            return m.deep(sf.reverse(f), mi.reverseTree(n -> n.reverse(f)), pr.reverse(f));
        }

        @Override
        public <R> R foldLeft(R z, BiFunction<R, ? super A, R> f) {
            R r = pr.foldLeft(z, f);
            r = mi.foldLeft(r, (acc, n) -> n.foldLeft(acc, f));
            return sf.foldLeft(r, f);
        }

        @Override
        public <R> R foldRight(R z, BiFunction<? super A, R, R> f) {
            R r = sf.foldRight(z, f);
            r = mi.foldRight(r, (n, acc) -> n.foldRight(acc, f));
            return pr.foldRight(r, f);
        }
    }

    // ------------------------------------------------------------------------
    // Concatenation

    /**
     * Concatenates two trees with a list of loose elements in between. The
     * digits meeting in the middle are regrouped into nodes and pushed one
     * level down, so the work is proportional to the depth of the shallower
     * tree.
     */
    static <V,A> FTree<V,A> concat(FTree<V,A> xs, List<A> ts, FTree<V,A> ys) {
        if (xs.isEmpty()) {
            FTree<V,A> t = ys;
            for (int i = ts.size(); --i >= 0; ) {
                t = t.cons(ts.get(i));
            }
            return t;
        }

        if (ys.isEmpty()) {
            FTree<V,A> t = xs;
            for (A a : ts) {
                t = t.snoc(a);
            }
            return t;
        }

        if (xs instanceof Single) {
            return concat(xs.m.empty(), ts, ys).cons(xs.head());
        }

        if (ys instanceof Single) {
            return concat(xs, ts, ys.m.empty()).snoc(ys.head());
        }

        Deep<V,A> l = (Deep<V,A>)xs, r = (Deep<V,A>)ys;
        FTMaker<V,A> m = l.m;

        List<A> middle = new ArrayList<>(l.sf.size() + ts.size() + r.pr.size());
        middle.addAll(l.sf.toList());
        middle.addAll(ts);
        middle.addAll(r.pr.toList());

        V v = l.v;
        for (A a : ts) {
            v = m.sum(v, m.measure(a));
        }
        v = m.sum(v, r.v);
        return m.deep(v, l.pr, concat(l.mi, nodes(m, middle), r.mi), r.sf);
    }

    /**
     * Groups between 2 and 12 elements into nodes of 2 or 3 elements,
     * preferring nodes of 3.
     */
    static <V,A> List<Node<V,A>> nodes(FTMaker<V,A> m, List<A> xs) {
        List<Node<V,A>> ns = new ArrayList<>(4);
        int i = 0, n = xs.size();
        for (; n - i > 4; i += 3) {
            ns.add(m.node(xs.get(i), xs.get(i + 1), xs.get(i + 2)));
        }
        switch (n - i) {
          case 2:
            ns.add(m.node(xs.get(i), xs.get(i + 1)));
            break;
          case 3:
            ns.add(m.node(xs.get(i), xs.get(i + 1), xs.get(i + 2)));
            break;
          case 4:
            ns.add(m.node(xs.get(i), xs.get(i + 1)));
            ns.add(m.node(xs.get(i + 2), xs.get(i + 3)));
            break;
          default:
            throw new AssertionError("too few elements to group into nodes: " + n);
        }
        return ns;
    }
}
