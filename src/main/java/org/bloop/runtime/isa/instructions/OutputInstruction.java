package org.bloop.runtime.isa.instructions;

import org.bloop.runtime.internal.services.ExecutionContext;
import org.bloop.runtime.isa.Instruction;
import org.bloop.runtime.model.Parity;

/**
 * Handles the O instruction. Odd values are written as a decimal digit, even values as the
 * letter at that position in the alphabet (2 = B, 4 = D, 6 = F).
 */
public class OutputInstruction extends Instruction {

    /**
     * Constructs a new OutputInstruction.
     * @param symbol The command character.
     * @param name The mnemonic.
     */
    public OutputInstruction(char symbol, String name) {
        super(symbol, name);
    }

    @Override
    public void execute(ExecutionContext context) {
        context.emit(render(context.getAccumulator().getValue()));
    }

    /**
     * Renders an accumulator value as an output character.
     * @param value A value within the accumulator range.
     * @return The digit or letter for the value.
     */
    public static char render(int value) {
        if (Parity.of(value) == Parity.ODD) {
            return (char) ('0' + value);
        }
        return (char) ('A' - 1 + value);
    }
}
