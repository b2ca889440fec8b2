package org.bloop.runtime.spi;

/**
 * Receives side-channel notifications while a program runs.
 * <p>
 * Listeners observe the run but cannot influence it: the interpreter ignores anything a
 * listener does, and the output, accumulator and step count are the same with or without one.
 * All methods have empty defaults so implementations override only what they need.
 * </p>
 */
public interface IExecutionListener {

    /**
     * A listener that ignores every notification.
     */
    IExecutionListener NONE = new IExecutionListener() {};

    /**
     * Called after an output command appended a character to the output.
     *
     * @param symbol The emitted character.
     * @param position The cursor position of the output command.
     */
    default void onOutput(char symbol, int position) {
    }

    /**
     * Called each time the cursor passes over a character that is not a command.
     * Inert characters inside a repeating loop are reported on every pass.
     *
     * @param symbol The inert character.
     * @param position Its position in the source.
     */
    default void onInertCharacter(char symbol, int position) {
    }
}
