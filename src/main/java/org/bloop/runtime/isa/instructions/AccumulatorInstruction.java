package org.bloop.runtime.isa.instructions;

import org.bloop.runtime.internal.services.ExecutionContext;
import org.bloop.runtime.isa.Instruction;
import org.bloop.runtime.model.Accumulator;

/**
 * Handles the instructions that move the accumulator around the ring: B (raise), L (lower)
 * and P (parity bridge). The step size depends on the parity before the move.
 */
public class AccumulatorInstruction extends Instruction {

    /**
     * Constructs a new AccumulatorInstruction.
     * @param symbol One of 'B', 'L' or 'P'.
     * @param name The mnemonic.
     */
    public AccumulatorInstruction(char symbol, String name) {
        super(symbol, name);
    }

    @Override
    public void execute(ExecutionContext context) {
        Accumulator accumulator = context.getAccumulator();
        accumulator.add(deltaFor(accumulator.isOdd()));
    }

    /**
     * Computes the delta this instruction applies.
     * @param odd Whether the accumulator is currently odd.
     * @return The signed delta.
     */
    public int deltaFor(boolean odd) {
        switch (symbol) {
            case 'B':
                return odd ? 1 : 2;
            case 'L':
                return odd ? -1 : -2;
            case 'P':
                // Always crosses the parity boundary: 1->2, 3->4, 5->6 and 2->1, 4->3, 6->5
                return odd ? 1 : -1;
            default:
                throw new IllegalStateException("Unknown accumulator instruction: " + symbol);
        }
    }
}
