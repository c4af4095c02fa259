/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package net.fingerseq.collect;

import com.google.common.collect.ImmutableList;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

public class InvariantChecksTest {
    private String saved;

    @Before
    public void enableChecks() {
        saved = System.getProperty(InvariantChecks.PROPERTY_KEY);
        System.setProperty(InvariantChecks.PROPERTY_KEY, "true");
    }

    @After
    public void restore() {
        if (saved == null) {
            System.clearProperty(InvariantChecks.PROPERTY_KEY);
        } else {
            System.setProperty(InvariantChecks.PROPERTY_KEY, saved);
        }
    }

    @Test
    public void switchReadOnEachCall() {
        assertTrue(InvariantChecks.enabled());
        System.setProperty(InvariantChecks.PROPERTY_KEY, "false");
        assertFalse(InvariantChecks.enabled());
    }

    @Test
    public void orderedInputAccepted() {
        assertThat(MultiSet.fromAscList(ImmutableList.of(1, 1, 2)).size(), is(3));
        assertThat(MultiSet.fromDescList(ImmutableList.of(2, 1, 1)).size(), is(3));
        assertThat(MultiSet.fromDistinctAscList(ImmutableList.of(1, 2)).size(), is(2));
        assertThat(MultiSet.fromDistinctDescList(ImmutableList.of(2, 1)).size(), is(2));
        assertThat(OrderedSet.fromDistinctAscList(ImmutableList.of(1, 2)).size(), is(2));
        assertThat(MultiSet.of(1, 2).mapMonotonic(x -> x + 10).toList(), is(ImmutableList.of(11, 12)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void fromAscListRejectsDescending() {
        MultiSet.fromAscList(ImmutableList.of(2, 1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void fromDescListRejectsAscending() {
        MultiSet.fromDescList(ImmutableList.of(1, 2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void fromDistinctAscListRejectsDuplicates() {
        MultiSet.fromDistinctAscList(ImmutableList.of(1, 1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void fromDistinctDescListRejectsAscending() {
        MultiSet.fromDistinctDescList(ImmutableList.of(1, 2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void orderedSetRejectsUnsortedInput() {
        OrderedSet.fromDistinctAscList(ImmutableList.of(3, 1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void mapMonotonicRejectsDecreasingFunction() {
        MultiSet.of(1, 2, 3).mapMonotonic(x -> -x);
    }

    @Test
    public void uncheckedWhenDisabled() {
        System.setProperty(InvariantChecks.PROPERTY_KEY, "false");
        // unsorted input is taken on trust
        assertThat(MultiSet.fromDistinctAscList(ImmutableList.of(3, 1)).size(), is(2));
    }
}
