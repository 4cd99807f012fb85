package org.normharvest.http;

import org.slf4j.LoggerFactory;

/**
 * Changes the outbound IP address after a site starts blocking us.
 */
@FunctionalInterface
public interface EgressRotator {
    EgressRotator NONE = () -> {
        LoggerFactory.getLogger(EgressRotator.class).info("VPN is not enabled, skipping egress rotation");
        return false;
    };

    /**
     * @return true if a new egress route is in place
     */
    boolean rotate();

    /**
     * Counts completed rotations. Read it before a request so that a block seen on the response can be
     * tied to the route it was made through.
     */
    default long generation() {
        return 0;
    }

    /**
     * Rotates only if nobody has rotated since {@code seenGeneration}.
     */
    default boolean rotate(long seenGeneration) {
        return rotate();
    }
}
