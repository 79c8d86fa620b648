package com.expecta.analyzer.engine;

/** What the environment keeps between two parses. */
public enum ResetPolicy {
    /** Every slot back to nil; ad-hoc slots are forgotten. */
    RESET,
    /**
     * Only {@code concept} is cleared. Control and ad-hoc slots keep whatever the
     * previous sentence left until a request overwrites them.
     */
    CARRY_OVER
}
