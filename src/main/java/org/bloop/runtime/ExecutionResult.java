package org.bloop.runtime;

/**
 * The outcome of a single program run.
 * <p>
 * A run that hits the step ceiling is an expected outcome, not an error: the output produced
 * until then is kept and {@link #termination()} is {@link Termination#STEP_LIMIT_EXCEEDED}.
 * </p>
 *
 * @param output           Everything the program emitted, in order.
 * @param termination      How the run ended.
 * @param steps            The number of commands executed.
 * @param maxSteps         The step ceiling the run was given.
 * @param finalAccumulator The accumulator value when the run ended.
 */
public record ExecutionResult(String output, Termination termination, int steps, int maxSteps, int finalAccumulator) {

    public boolean isCompleted() {
        return termination == Termination.COMPLETED;
    }

    public boolean isStepLimitExceeded() {
        return termination == Termination.STEP_LIMIT_EXCEEDED;
    }
}
