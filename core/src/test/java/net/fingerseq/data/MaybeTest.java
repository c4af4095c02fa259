/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package net.fingerseq.data;

import java.util.NoSuchElementException;

import org.junit.Test;
import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static net.fingerseq.data.MaybeMatchers.*;

public class MaybeTest {
    @Test
    public void presentValue() {
        Maybe<String> m = Maybe.of("a");
        assertThat(m, just("a"));
        assertThat(m.map(s -> s + "b"), just("ab"));
        assertThat(m.filter(String::isEmpty), is(nothing()));
        assertThat(m.orElse("z"), is("a"));
        assertThat(m.toList().size(), is(1));
        assertThat(m.toString(), is("Just a"));
    }

    @Test
    public void absentValue() {
        Maybe<String> m = Maybe.empty();
        assertThat(m, is(nothing()));
        assertTrue(m.isAbsent());
        assertThat(m.map(s -> s + "b"), is(nothing()));
        assertThat(m.orElse("z"), is("z"));
        assertTrue(m.toList().isEmpty());
        assertThat(m.toString(), is("Nothing"));
    }

    @Test(expected = NoSuchElementException.class)
    public void getAbsent() {
        Maybe.empty().get();
    }

    @Test(expected = NullPointerException.class)
    public void nullNotPermitted() {
        Maybe.of(null);
    }

    @Test
    public void equality() {
        assertEquals(Maybe.of(1), Maybe.of(1));
        assertNotEquals(Maybe.of(1), Maybe.of(2));
        assertNotEquals(Maybe.of(1), Maybe.empty());
        assertEquals(Maybe.of(1).hashCode(), Maybe.of(1).hashCode());
    }
}
