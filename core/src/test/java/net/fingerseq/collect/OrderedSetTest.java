/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package net.fingerseq.collect;

import java.util.Comparator;
import java.util.Random;
import java.util.TreeSet;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static net.fingerseq.data.MaybeMatchers.*;

public class OrderedSetTest {
    @Test
    public void insertAndContains() {
        OrderedSet<Integer> s = OrderedSet.of(5, 1, 3, 1, 5);
        assertThat(s.size(), is(3));
        assertThat(s.toList(), is(ImmutableList.of(1, 3, 5)));
        assertTrue(s.contains(3));
        assertFalse(s.contains(4));
        assertSame(s, s.insert(3));
    }

    @Test
    public void delete() {
        OrderedSet<Integer> s = OrderedSet.of(1, 2, 3);
        assertThat(s.delete(2).toList(), is(ImmutableList.of(1, 3)));
        assertSame(s, s.delete(7));
        assertTrue(s.delete(1).delete(2).delete(3).isEmpty());
    }

    @Test
    public void minAndMax() {
        assertThat(OrderedSet.of(4, 2, 8).min(), just(2));
        assertThat(OrderedSet.of(4, 2, 8).max(), just(8));
        assertThat(OrderedSet.<Integer>empty().min(), is(nothing()));
        assertThat(OrderedSet.<Integer>empty().max(), is(nothing()));
    }

    @Test
    public void setAlgebra() {
        OrderedSet<Integer> a = OrderedSet.of(1, 2, 3, 4), b = OrderedSet.of(3, 4, 5);
        assertThat(a.union(b).toList(), is(ImmutableList.of(1, 2, 3, 4, 5)));
        assertThat(a.intersection(b).toList(), is(ImmutableList.of(3, 4)));
        assertThat(a.difference(b).toList(), is(ImmutableList.of(1, 2)));
        assertFalse(a.isDisjointFrom(b));
        assertTrue(a.difference(b).isDisjointFrom(b));
        assertTrue(a.intersection(b).isSubsetOf(a));
        assertFalse(a.isSubsetOf(b));
    }

    @Test
    public void agreesWithTreeSet() {
        Random random = new Random(42);
        OrderedSet<Integer> s = OrderedSet.empty();
        TreeSet<Integer> ref = new TreeSet<>();
        for (int i = 0; i < 2000; i++) {
            int x = random.nextInt(300);
            if (random.nextInt(3) == 0) {
                s = s.delete(x);
                ref.remove(x);
            } else {
                s = s.insert(x);
                ref.add(x);
            }
        }
        assertThat(s.toList(), is(ImmutableList.copyOf(ref)));
        assertThat(s.size(), is(ref.size()));
    }

    @Test
    public void fromDistinctAscList() {
        OrderedSet<String> s = OrderedSet.fromDistinctAscList(ImmutableList.of("a", "b", "c"));
        assertThat(s, is(OrderedSet.of("c", "b", "a")));
        assertThat(s.hashCode(), is(OrderedSet.of("c", "b", "a").hashCode()));
        assertThat(s.toString(), is("OrderedSet[a, b, c]"));
    }

    @Test
    public void customComparator() {
        OrderedSet<String> s = OrderedSet.fromList(Comparator.comparing(String::length), ImmutableList.of("ccc", "a", "bb", "x"));
        assertThat(s.toList(), is(ImmutableList.of("a", "bb", "ccc")));
        assertTrue(s.contains("z"));
    }

    @Test
    public void emptyWithComparator() {
        OrderedSet<String> s = OrderedSet.empty(Comparator.comparing(String::length));
        assertTrue(s.isEmpty());
        assertThat(s.insert("bb").insert("a").insert("x").toList(), is(ImmutableList.of("a", "bb")));

        OrderedSet<Integer> desc = OrderedSet.fromDistinctAscList(Comparator.<Integer>reverseOrder(), ImmutableList.of(3, 2, 1));
        assertThat(desc.min(), just(3));
        assertTrue(desc.contains(2));
    }

    @Test
    public void equalityFollowsComparator() {
        OrderedSet<String> lower = OrderedSet.fromList(String.CASE_INSENSITIVE_ORDER, ImmutableList.of("a", "b"));
        OrderedSet<String> upper = OrderedSet.fromList(String.CASE_INSENSITIVE_ORDER, ImmutableList.of("B", "A"));
        assertThat(lower, is(upper));
        assertThat(upper, is(lower));

        OrderedSet<String> natural = OrderedSet.of("a", "b");
        assertThat(lower, is(not(natural)));
        assertThat(natural, is(not(lower)));
        assertThat(OrderedSet.fromList(Comparator.<Integer>reverseOrder(), ImmutableList.of(1, 2)),
                   is(not(OrderedSet.of(1, 2))));
    }
}
