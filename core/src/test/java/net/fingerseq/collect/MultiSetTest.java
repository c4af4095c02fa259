/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package net.fingerseq.collect;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static net.fingerseq.data.MaybeMatchers.*;

public class MultiSetTest {
    private static MultiSet<Integer> ms(Integer... xs) {
        return MultiSet.fromList(ImmutableList.copyOf(xs));
    }

    @Test
    public void countsAndSizes() {
        MultiSet<Integer> m = ms(3, 1, 2, 1);
        assertThat(m.count(1), is(2));
        assertThat(m.count(2), is(1));
        assertThat(m.count(7), is(0));
        assertThat(m.size(), is(4));
        assertThat(m.uniqueCount(), is(3));
        assertThat(m.toList(), is(ImmutableList.of(1, 1, 2, 3)));
    }

    @Test
    public void insertExisting() {
        MultiSet<Integer> m = ms(3, 1, 2, 1).insert(1);
        assertThat(m.count(1), is(3));
        assertThat(m.uniqueCount(), is(3));
    }

    @Test
    public void insertNewKeepsOrder() {
        MultiSet<Integer> m = ms(10, 30).insert(20).insert(40).insert(0);
        assertThat(m.toList(), is(ImmutableList.of(0, 10, 20, 30, 40)));
    }

    @Test
    public void insertOccurrences() {
        MultiSet<Integer> m = ms(5).insert(5, 3).insert(2, 2);
        assertThat(m.count(5), is(4));
        assertThat(m.count(2), is(2));
        assertThat(m.size(), is(6));
        assertSame(m, m.insert(9, 0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void insertNegativeOccurrences() {
        ms(1).insert(1, -1);
    }

    @Test(expected = ArithmeticException.class)
    public void insertOverflow() {
        ms(1).insert(1, Integer.MAX_VALUE);
    }

    @Test(expected = NullPointerException.class)
    public void nullNotPermitted() {
        MultiSet.<Integer>empty().insert(null);
    }

    @Test
    public void deleteOnce() {
        assertTrue(ms(1).deleteOnce(1).isEmpty());
        assertThat(ms(1).deleteOnce(5), is(ms(1)));
        assertThat(ms(1, 1, 2).deleteOnce(1).toList(), is(ImmutableList.of(1, 2)));
    }

    @Test
    public void deleteAbsentReturnsSameInstance() {
        MultiSet<Integer> m = ms(1, 3, 5);
        assertSame(m, m.deleteOnce(2));
        assertSame(m, m.deleteOnce(9));
        assertSame(m, m.deleteAll(4));
        assertSame(m, m.deleteAll(0));
        assertThat(m.deleteOnce(2).toList(), is(ImmutableList.of(1, 3, 5)));
    }

    @Test
    public void deleteAll() {
        MultiSet<Integer> m = ms(1, 2, 2, 2, 3).deleteAll(2);
        assertThat(m.toList(), is(ImmutableList.of(1, 3)));
        assertThat(m.count(2), is(0));
        assertFalse(m.contains(2));
    }

    @Test
    public void deleteOnceRepeatedlyRemovesRecord() {
        MultiSet<String> m = MultiSet.of("a", "b", "b", "b", "c");
        for (int i = 0; i < 3; i++) {
            assertTrue(m.contains("b"));
            m = m.deleteOnce("b");
        }
        assertFalse(m.contains("b"));
        assertThat(m.uniqueCount(), is(2));
        assertThat(m.toList(), is(ImmutableList.of("a", "c")));
    }

    @Test
    public void union() {
        assertThat(ms(1, 1, 2).union(ms(1, 3)).toList(), is(ImmutableList.of(1, 1, 1, 2, 3)));
        assertThat(ms().union(ms(4)), is(ms(4)));
        assertThat(ms(4).union(ms()), is(ms(4)));
    }

    @Test
    public void intersection() {
        assertThat(ms(1, 1, 1, 2, 3).intersection(ms(1, 1, 3, 4)).toList(), is(ImmutableList.of(1, 1, 3)));
        assertTrue(ms(1, 2).intersection(ms(3, 4)).isEmpty());
    }

    @Test
    public void difference() {
        assertThat(ms(1, 1, 1, 2, 3).difference(ms(1, 2, 2, 4)).toList(), is(ImmutableList.of(1, 1, 3)));
        assertThat(ms(1, 2).difference(ms()), is(ms(1, 2)));
        assertTrue(ms(1, 2).difference(ms(1, 1, 2)).isEmpty());
    }

    @Test
    public void subsetAndSuperset() {
        assertTrue(ms(1, 1).isSubsetOf(ms(1, 1, 2)));
        assertFalse(ms(1, 1, 1).isSubsetOf(ms(1, 1, 2)));
        assertTrue(ms(1, 1, 2).isSupsetOf(ms(1, 1)));
        assertTrue(ms().isSubsetOf(ms()));
        assertTrue(ms().isSubsetOf(ms(1)));
        assertFalse(ms(1).isSubsetOf(ms()));
        assertFalse(ms(0, 1).isSubsetOf(ms(1, 1, 1)));
        assertFalse(ms(1, 5).isSubsetOf(ms(1, 2, 3, 4)));
    }

    @Test
    public void disjoint() {
        assertTrue(ms(1, 3, 5).isDisjointFrom(ms(2, 4, 6)));
        assertFalse(ms(1, 3, 5).isDisjointFrom(ms(5, 6)));
        assertTrue(ms().isDisjointFrom(ms(1)));
    }

    @Test
    public void orderStatistics() {
        MultiSet<Integer> m = ms(5, 1, 3, 3, 3, 9);
        assertThat(m.smallestElem(), just(1));
        assertThat(m.largestElem(), just(9));
        assertThat(m.kthSmallestElem(1), just(1));
        assertThat(m.kthSmallestElem(2), just(3));
        assertThat(m.kthSmallestElem(4), just(3));
        assertThat(m.kthSmallestElem(5), just(5));
        assertThat(m.kthSmallestElem(6), just(9));
        assertThat(m.kthLargestElem(1), just(9));
        assertThat(m.kthLargestElem(3), just(3));
        assertThat(m.kthSmallestUniqueElem(2), just(3));
        assertThat(m.kthSmallestUniqueElem(3), just(5));
        assertThat(m.kthLargestUniqueElem(1), just(9));
        assertThat(m.kthLargestUniqueElem(4), just(1));
    }

    @Test
    public void orderStatisticsOutOfRange() {
        MultiSet<Integer> m = ms(5, 1, 3);
        assertThat(m.kthSmallestElem(0), is(nothing()));
        assertThat(m.kthSmallestElem(-1), is(nothing()));
        assertThat(m.kthSmallestElem(4), is(nothing()));
        assertThat(m.kthLargestElem(4), is(nothing()));
        assertThat(m.kthLargestElem(0), is(nothing()));
        assertThat(m.kthSmallestUniqueElem(4), is(nothing()));
        assertThat(m.kthLargestUniqueElem(Integer.MIN_VALUE), is(nothing()));
        assertThat(ms().smallestElem(), is(nothing()));
        assertThat(ms().largestElem(), is(nothing()));
    }

    @Test
    public void bulkBuilders() {
        MultiSet<Integer> expected = ms(1, 2, 2, 3);
        assertThat(MultiSet.fromAscList(ImmutableList.of(1, 2, 2, 3)), is(expected));
        assertThat(MultiSet.fromDescList(ImmutableList.of(3, 2, 2, 1)), is(expected));
        assertThat(MultiSet.fromDistinctAscList(ImmutableList.of(1, 2, 3)), is(ms(3, 2, 1)));
        assertThat(MultiSet.fromDistinctDescList(ImmutableList.of(3, 2, 1)), is(ms(1, 2, 3)));
        assertThat(MultiSet.fromAscList(ImmutableList.of(1, 2, 2, 3)).uniqueCount(), is(3));
        assertThat(MultiSet.fromDescList(ImmutableList.of(3, 3, 3)).toList(), is(ImmutableList.of(3, 3, 3)));
    }

    @Test
    public void customComparator() {
        MultiSet<String> m = MultiSet.fromList(String.CASE_INSENSITIVE_ORDER, ImmutableList.of("b", "A", "a", "C"));
        assertThat(m.count("A"), is(2));
        assertThat(m.uniqueCount(), is(3));
        assertThat(m.toList(), is(ImmutableList.of("A", "A", "b", "C")));

        MultiSet<Integer> desc = MultiSet.fromList(Comparator.<Integer>reverseOrder(), ImmutableList.of(1, 3, 2, 3));
        assertThat(desc.toList(), is(ImmutableList.of(3, 3, 2, 1)));
        assertThat(desc.smallestElem(), just(3));
    }

    @Test
    public void map() {
        MultiSet<Integer> m = ms(-2, -1, 1, 2, 2).map(x -> x * x);
        assertThat(m.toList(), is(ImmutableList.of(1, 1, 4, 4, 4)));
        assertThat(m.uniqueCount(), is(2));
    }

    @Test
    public void mapMonotonic() {
        MultiSet<String> m = ms(1, 2, 2, 10).mapMonotonic(x -> String.format("%03d", x));
        assertThat(m.toList(), is(ImmutableList.of("001", "002", "002", "010")));
        assertThat(m.count("002"), is(2));
        assertThat(m.kthSmallestElem(4), just("010"));
    }

    @Test
    public void support() {
        OrderedSet<Integer> s = ms(4, 1, 4, 2, 1).support();
        assertThat(s.toList(), is(ImmutableList.of(1, 2, 4)));
        assertThat(s.size(), is(3));
    }

    @Test
    public void forEachEntry() {
        Map<Integer, Integer> entries = new LinkedHashMap<>();
        ms(3, 1, 3, 2, 3).forEachEntry(entries::put);
        assertThat(entries, is(ImmutableMap.of(1, 1, 2, 1, 3, 3)));
    }

    @Test
    public void equality() {
        assertThat(ms(1, 2, 2), is(ms(2, 1, 2)));
        assertThat(ms(1, 2, 2).hashCode(), is(ms(2, 1, 2).hashCode()));
        assertThat(ms(1, 2, 2), is(not(ms(1, 2))));
        assertThat(ms(1, 2, 2), is(not(ms(1, 1, 2))));
        assertFalse(MultiSet.of("a").equals(ms(1)));
        assertThat(ms(2, 1, 1).toString(), is("MultiSet[1, 1, 2]"));
    }

    @Test
    public void persistence() {
        MultiSet<Integer> m = ms(1, 2, 3);
        m.insert(2).deleteAll(1).union(ms(7));
        assertThat(m.toList(), is(ImmutableList.of(1, 2, 3)));
    }

    @Test
    public void equalityFollowsComparator() {
        MultiSet<String> lower = MultiSet.fromList(String.CASE_INSENSITIVE_ORDER, ImmutableList.of("a", "a", "b"));
        MultiSet<String> mixed = MultiSet.fromList(String.CASE_INSENSITIVE_ORDER, ImmutableList.of("B", "A", "a"));
        assertThat(lower, is(mixed));
        assertThat(mixed, is(lower));

        MultiSet<String> natural = MultiSet.of("a", "a", "b");
        assertThat(lower, is(not(natural)));
        assertThat(natural, is(not(lower)));

        MultiSet<Integer> desc = MultiSet.fromList(Comparator.<Integer>reverseOrder(), ImmutableList.of(1, 2, 2));
        assertThat(desc, is(not(ms(1, 2, 2))));
        assertThat(ms(1, 2, 2), is(not(desc)));
    }

    @Test(expected = ArithmeticException.class)
    public void sizeBeyondIntRangeIsRejected() {
        MultiSet.<Integer>empty().insert(1, Integer.MAX_VALUE).insert(2);
    }
}
