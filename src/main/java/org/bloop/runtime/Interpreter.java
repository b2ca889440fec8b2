package org.bloop.runtime;

import org.bloop.runtime.internal.services.ExecutionContext;
import org.bloop.runtime.isa.Instruction;
import org.bloop.runtime.spi.IExecutionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The core of the execution environment.
 * This class runs BLOOP programs from left to right over a fresh {@link ExecutionContext}.
 * It holds only immutable configuration, so one instance can run any number of programs.
 */
public class Interpreter {

    private static final Logger LOGGER = LoggerFactory.getLogger(Interpreter.class);

    private final int maxSteps;
    private final IExecutionListener listener;

    /**
     * Creates an interpreter with the {@link Config#DEFAULT_MAX_STEPS default} step ceiling.
     */
    public Interpreter() {
        this(Config.DEFAULT_MAX_STEPS);
    }

    /**
     * Creates an interpreter without a listener.
     *
     * @param maxSteps The step ceiling, must be positive.
     */
    public Interpreter(int maxSteps) {
        this(maxSteps, IExecutionListener.NONE);
    }

    /**
     * Creates an interpreter.
     *
     * @param maxSteps The step ceiling, must be positive.
     * @param listener Receives side-channel notifications during each run.
     * @throws IllegalArgumentException if {@code maxSteps} is not positive or the listener is null.
     */
    public Interpreter(int maxSteps, IExecutionListener listener) {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive, got " + maxSteps);
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        this.maxSteps = maxSteps;
        this.listener = listener;
    }

    /**
     * Runs a program until the cursor passes its end or the step ceiling is reached.
     * <p>
     * Every executed command costs one step, including loop brackets and every repeated
     * iteration. Inert characters cost nothing. The run stops as soon as the step count
     * reaches the ceiling.
     * </p>
     *
     * @param source The program text.
     * @return The produced output and how the run ended.
     * @throws IllegalArgumentException if {@code source} is null.
     */
    public ExecutionResult run(String source) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }

        ExecutionContext context = new ExecutionContext(source, listener);
        int steps = 0;

        while (!context.isFinished()) {
            Instruction instruction = Instruction.getBySymbol(context.currentSymbol());
            if (instruction == null) {
                context.reportInert();
                context.advance();
                continue;
            }

            instruction.execute(context);
            steps++;
            if (steps >= maxSteps) {
                LOGGER.debug("Step limit of {} reached at position {} with {} open loop(s).",
                        maxSteps, context.getIp(), context.getLoopStack().size());
                return result(context, Termination.STEP_LIMIT_EXCEEDED, steps);
            }
            context.advance();
        }

        LOGGER.debug("Program finished after {} step(s), accumulator={}, open loops={}.",
                steps, context.getAccumulator().getValue(), context.getLoopStack().size());
        return result(context, Termination.COMPLETED, steps);
    }

    private ExecutionResult result(ExecutionContext context, Termination termination, int steps) {
        return new ExecutionResult(context.getOutput(), termination, steps, maxSteps,
                context.getAccumulator().getValue());
    }

    public int getMaxSteps() {
        return maxSteps;
    }
}
