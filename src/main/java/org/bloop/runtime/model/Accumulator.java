package org.bloop.runtime.model;

import org.bloop.runtime.Config;

/**
 * The single mutable register of the BLOOP machine.
 * <p>
 * The value always stays within [{@link Config#ACCUMULATOR_MIN}, {@link Config#ACCUMULATOR_MAX}];
 * every mutation is routed through {@link #wrap(int, int)}.
 * </p>
 */
public final class Accumulator {

    private int value;

    /**
     * Creates an accumulator holding {@link Config#INITIAL_ACCUMULATOR}.
     */
    public Accumulator() {
        this(Config.INITIAL_ACCUMULATOR);
    }

    /**
     * Creates an accumulator holding the given value.
     * @param value The initial value, must be within the accumulator range.
     * @throws IllegalArgumentException if the value is outside the range.
     */
    public Accumulator(int value) {
        if (value < Config.ACCUMULATOR_MIN || value > Config.ACCUMULATOR_MAX) {
            throw new IllegalArgumentException("Accumulator value must be within ["
                    + Config.ACCUMULATOR_MIN + ", " + Config.ACCUMULATOR_MAX + "], got " + value);
        }
        this.value = value;
    }

    /**
     * Applies a delta to a value on the ring of accumulator values.
     * <p>
     * The value is shifted into 0-based space, the delta is applied, and the remainder is
     * normalized with an extra {@code + RING_SIZE} because Java's {@code %} keeps the sign of the
     * dividend. The delta is reduced first so that large magnitudes cannot overflow.
     * </p>
     *
     * @param value A value within the accumulator range.
     * @param delta Any integer delta.
     * @return The representative within the accumulator range congruent to {@code value + delta}.
     */
    public static int wrap(int value, int delta) {
        int reducedDelta = delta % Config.RING_SIZE;
        int offset = (value - Config.ACCUMULATOR_MIN + reducedDelta) % Config.RING_SIZE;
        return (offset + Config.RING_SIZE) % Config.RING_SIZE + Config.ACCUMULATOR_MIN;
    }

    /**
     * Adds a delta, wrapping around the ring.
     * @param delta The delta to apply.
     */
    public void add(int delta) {
        this.value = wrap(this.value, delta);
    }

    public int getValue() {
        return value;
    }

    public Parity getParity() {
        return Parity.of(value);
    }

    public boolean isOdd() {
        return getParity() == Parity.ODD;
    }

    @Override
    public String toString() {
        return "Accumulator[" + value + "]";
    }
}
