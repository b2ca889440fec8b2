package org.bloop.runtime.isa.instructions;

import org.bloop.runtime.internal.services.ExecutionContext;
import org.bloop.runtime.isa.Instruction;
import org.bloop.runtime.model.LoopFrame;

import java.util.Deque;

/**
 * Handles the loop brackets.
 * <p>
 * '(' pushes a {@link LoopFrame} recording where the body starts and the parity at entry.
 * ')' checks the exit condition of the innermost open loop: it pops the frame when the
 * condition holds and jumps back to the body otherwise. An unmatched ')' does nothing.
 * </p>
 */
public class LoopInstruction extends Instruction {

    /**
     * Constructs a new LoopInstruction.
     * @param symbol '(' or ')'.
     * @param name The mnemonic.
     */
    public LoopInstruction(char symbol, String name) {
        super(symbol, name);
    }

    @Override
    public void execute(ExecutionContext context) {
        Deque<LoopFrame> loopStack = context.getLoopStack();
        if (symbol == '(') {
            loopStack.push(new LoopFrame(context.getIp() + 1, context.getAccumulator().getParity()));
            return;
        }

        LoopFrame top = loopStack.peek();
        if (top == null) {
            return;
        }
        if (top.isSatisfiedBy(context.getAccumulator().getValue())) {
            loopStack.pop();
        } else {
            context.jumpTo(top.returnPosition());
        }
    }
}
