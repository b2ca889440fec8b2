package org.bloop.runtime.model;

/**
 * A record of an open loop on the loop-control stack.
 *
 * @param returnPosition The cursor position right after the opening bracket.
 * @param entryParity    The accumulator parity at the moment the loop was opened.
 */
public record LoopFrame(int returnPosition, Parity entryParity) {

    /**
     * Checks the exit condition fixed when the loop was opened.
     * @param accumulatorValue The current accumulator value.
     * @return true if the loop is done.
     */
    public boolean isSatisfiedBy(int accumulatorValue) {
        return accumulatorValue == entryParity.loopExitValue();
    }
}
