package org.bloop.runtime;

/**
 * Provides the fixed constants of the BLOOP machine.
 * This final class contains static constants that define the accumulator ring, the loop
 * exit values and the default step ceiling. It is not meant to be instantiated.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * The smallest value the accumulator can hold.
     */
    public static final int ACCUMULATOR_MIN = 1;

    /**
     * The largest value the accumulator can hold.
     */
    public static final int ACCUMULATOR_MAX = 6;

    /**
     * The number of distinct accumulator values (the size of the ring).
     */
    public static final int RING_SIZE = ACCUMULATOR_MAX - ACCUMULATOR_MIN + 1;

    /**
     * The accumulator value at the start of every run.
     */
    public static final int INITIAL_ACCUMULATOR = 1;

    /**
     * A loop entered with an odd accumulator exits when the accumulator equals this value.
     */
    public static final int ODD_ENTRY_EXIT_VALUE = 1;

    /**
     * A loop entered with an even accumulator exits when the accumulator equals this value.
     */
    public static final int EVEN_ENTRY_EXIT_VALUE = 6;

    /**
     * The step ceiling used when the caller does not choose one.
     */
    public static final int DEFAULT_MAX_STEPS = 1_000_000;

    /**
     * The initial capacity of the loop-control stack. The stack grows on demand.
     */
    public static final int LOOP_STACK_INITIAL_CAPACITY = 16;
}
