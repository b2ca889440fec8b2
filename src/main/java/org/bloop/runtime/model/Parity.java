package org.bloop.runtime.model;

import org.bloop.runtime.Config;

/**
 * The parity of an accumulator value. Every command's effect depends on it, and a loop
 * remembers the parity it was entered with to decide when to exit.
 */
public enum Parity {
    ODD(Config.ODD_ENTRY_EXIT_VALUE),
    EVEN(Config.EVEN_ENTRY_EXIT_VALUE);

    private final int loopExitValue;

    Parity(int loopExitValue) {
        this.loopExitValue = loopExitValue;
    }

    /**
     * Classifies a value.
     * @param value The value to classify.
     * @return {@link #ODD} for odd values, {@link #EVEN} otherwise.
     */
    public static Parity of(int value) {
        return value % 2 != 0 ? ODD : EVEN;
    }

    /**
     * Returns the accumulator value that ends a loop entered with this parity.
     * @return 1 for {@link #ODD}, 6 for {@link #EVEN}.
     */
    public int loopExitValue() {
        return loopExitValue;
    }
}
