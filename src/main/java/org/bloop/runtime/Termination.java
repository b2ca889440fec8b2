package org.bloop.runtime;

/**
 * How a run ended.
 */
public enum Termination {
    /** The cursor moved past the end of the program. */
    COMPLETED,
    /** The step ceiling was reached first. */
    STEP_LIMIT_EXCEEDED
}
