/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package net.fingerseq.data;

import java.util.function.BinaryOperator;

/**
 * A class for monoids (types with an associative binary operation that has
 * an identity). Instances should satisfy the following laws:
 *
 * <pre>{@code
 *      0 + x = x
 *      x + 0 = x
 *      x + (y + z) = (x + y) + z
 * }</pre>
 *
 * Finger trees use a monoid to sum the measures of their elements, so the
 * laws are what make a cached subtree measure independent of tree shape.
 */
public abstract class Monoid<A> {
    /**
     * Returns the identity value for this monoid.
     *
     * @return the identity value for this monoid
     */
    public abstract A empty();

    /**
     * Appends the two given values.
     *
     * @param a1 a value to append with another
     * @param a2 a value to append with another
     * @return the concatenation of the two given values
     */
    public abstract A append(A a1, A a2);

    static final class Strict<A> extends Monoid<A> {
        private final A empty;
        private final BinaryOperator<A> append;

        Strict(A empty, BinaryOperator<A> append) {
            this.empty = empty;
            this.append = append;
        }

        @Override
        public A empty() {
            return empty;
        }

        @Override
        public A append(A a1, A a2) {
            return append.apply(a1, a2);
        }
    }

    /**
     * Construct a monoid from the given append function and empty value, which
     * must follow the monoidal laws.
     *
     * @param empty the empty for the monoid
     * @param append the append function for the monoid
     * @return a monoid instance that uses the given empty value and append function
     */
    public static <A> Monoid<A> monoid(A empty, BinaryOperator<A> append) {
        return new Strict<>(empty, append);
    }

    // Monoid instances

    /**
     * A monoid that adds integers.
     */
    public static final Monoid<Integer> intSum = new Monoid<Integer>() {
        @Override
        public Integer empty() {
            return 0;
        }

        @Override
        public Integer append(Integer a1, Integer a2) {
            return a1 + a2;
        }
    };
}
