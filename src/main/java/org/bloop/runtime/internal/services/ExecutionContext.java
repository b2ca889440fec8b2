package org.bloop.runtime.internal.services;

import org.bloop.runtime.Config;
import org.bloop.runtime.model.Accumulator;
import org.bloop.runtime.model.LoopFrame;
import org.bloop.runtime.spi.IExecutionListener;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Encapsulates the complete mutable state of a single program run.
 * This object is created by the Interpreter for each run and passed to the executing
 * instructions to avoid global access. It is never shared between runs.
 */
public class ExecutionContext {

    private final String source;
    private final Accumulator accumulator;
    private final Deque<LoopFrame> loopStack;
    private final StringBuilder output;
    private final IExecutionListener listener;
    private int ip;
    private boolean skipIpAdvance;

    /**
     * Constructs a new ExecutionContext positioned at the start of the source.
     * @param source The program text.
     * @param listener The listener notified about emitted output.
     */
    public ExecutionContext(String source, IExecutionListener listener) {
        this.source = source;
        this.accumulator = new Accumulator();
        this.loopStack = new ArrayDeque<>(Config.LOOP_STACK_INITIAL_CAPACITY);
        this.output = new StringBuilder();
        this.listener = listener;
        this.ip = 0;
    }

    public Accumulator getAccumulator() {
        return accumulator;
    }

    public Deque<LoopFrame> getLoopStack() {
        return loopStack;
    }

    /**
     * Returns the current cursor position.
     * @return The index of the character about to be executed.
     */
    public int getIp() {
        return ip;
    }

    /**
     * Checks whether the cursor has moved past the last character.
     * @return true if the program is exhausted.
     */
    public boolean isFinished() {
        return ip >= source.length();
    }

    /**
     * Returns the character under the cursor.
     * @return The current character.
     */
    public char currentSymbol() {
        return source.charAt(ip);
    }

    /**
     * Appends a character to the run's output and notifies the listener.
     * @param symbol The character to emit.
     */
    public void emit(char symbol) {
        output.append(symbol);
        listener.onOutput(symbol, ip);
    }

    /**
     * Reports the character under the cursor as inert to the listener.
     */
    public void reportInert() {
        listener.onInertCharacter(currentSymbol(), ip);
    }

    /**
     * Moves the cursor to an absolute position. The following {@link #advance()} is skipped
     * so execution resumes exactly at that position.
     * @param position The new cursor position.
     */
    public void jumpTo(int position) {
        this.ip = position;
        this.skipIpAdvance = true;
    }

    /**
     * Moves the cursor one character forward, unless an instruction just jumped.
     */
    public void advance() {
        if (skipIpAdvance) {
            skipIpAdvance = false;
            return;
        }
        ip++;
    }

    public String getOutput() {
        return output.toString();
    }
}
