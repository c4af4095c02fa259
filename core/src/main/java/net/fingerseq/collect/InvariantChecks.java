/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package net.fingerseq.collect;

import java.util.Comparator;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Optional verification of the ordering preconditions that bulk builders
 * and monotonic maps take on trust.
 *
 * <p>Checks are off by default. They are switched on by the system property
 * {@value #PROPERTY_KEY} or, if that is unset, the environment variable
 * {@value #ENV_KEY}, with the value {@code true}. The switch is consulted on
 * every call.
 */
final class InvariantChecks {
    private static final Logger logger = Logger.getLogger(InvariantChecks.class.getName());

    static final String PROPERTY_KEY = "fingerseq.checkInvariants";
    static final String ENV_KEY = "FINGERSEQ_CHECK_INVARIANTS";

    private InvariantChecks() {}

    static boolean enabled() {
        String value = System.getProperty(PROPERTY_KEY);
        if (value == null)
            value = System.getenv(ENV_KEY);
        return Boolean.parseBoolean(value);
    }

    /**
     * Verifies that {@code next} follows {@code prev}.
     *
     * @param strict whether equal values are rejected
     * @param operation the name of the calling operation, for the message
     * @throws IllegalArgumentException if the values are out of order
     */
    static <T> void checkAscending(Comparator<? super T> c, T prev, T next, boolean strict, String operation) {
        int cmp = c.compare(prev, next);
        boolean ok = strict ? cmp < 0 : cmp <= 0;
        if (!ok) {
            logger.fine(() -> String.format("%s: %s is not %s %s",
                operation, next, strict ? "strictly after" : "after", prev));
        }
        checkArgument(ok, "%s: elements out of order: %s followed by %s", operation, prev, next);
    }
}
