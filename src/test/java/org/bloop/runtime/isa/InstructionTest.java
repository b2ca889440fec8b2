package org.bloop.runtime.isa;

import org.bloop.runtime.isa.instructions.AccumulatorInstruction;
import org.bloop.runtime.isa.instructions.LoopInstruction;
import org.bloop.runtime.isa.instructions.OutputInstruction;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class InstructionTest {

    @Test
    void instructionSet_shouldContainExactlySixCommands() {
        assertThat(Instruction.getInstructionSet().keySet()).containsExactly('B', 'L', 'O', 'P', '(', ')');
    }

    @Test
    void getBySymbol_shouldResolveFamilies() {
        assertThat(Instruction.getBySymbol('B')).isInstanceOf(AccumulatorInstruction.class);
        assertThat(Instruction.getBySymbol('L')).isInstanceOf(AccumulatorInstruction.class);
        assertThat(Instruction.getBySymbol('P')).isInstanceOf(AccumulatorInstruction.class);
        assertThat(Instruction.getBySymbol('O')).isInstanceOf(OutputInstruction.class);
        assertThat(Instruction.getBySymbol('(')).isInstanceOf(LoopInstruction.class);
        assertThat(Instruction.getBySymbol(')')).isInstanceOf(LoopInstruction.class);
    }

    @Test
    void inertCharacters_shouldHaveNoInstruction() {
        assertThat(Instruction.getBySymbol('b')).isNull();
        assertThat(Instruction.getBySymbol('!')).isNull();
        assertThat(Instruction.getBySymbol(' ')).isNull();
        assertThat(Instruction.isCommand('x')).isFalse();
        assertThat(Instruction.isCommand(')')).isTrue();
    }

    @Test
    void getByName_shouldBeCaseInsensitive() {
        assertThat(Instruction.getByName("bridge")).map(Instruction::getSymbol).contains('P');
        assertThat(Instruction.getByName("JUMP")).isEmpty();
    }

    @Test
    void containsCommand_shouldScanWholeText() {
        assertThat(Instruction.containsCommand("hello world")).isFalse();
        assertThat(Instruction.containsCommand("")).isFalse();
        assertThat(Instruction.containsCommand("just a comment then O")).isTrue();
    }

    @Test
    void accumulatorDeltas_shouldFollowParity() {
        AccumulatorInstruction raise = (AccumulatorInstruction) Instruction.getBySymbol('B');
        AccumulatorInstruction lower = (AccumulatorInstruction) Instruction.getBySymbol('L');
        AccumulatorInstruction bridge = (AccumulatorInstruction) Instruction.getBySymbol('P');

        assertThat(raise.deltaFor(true)).isEqualTo(1);
        assertThat(raise.deltaFor(false)).isEqualTo(2);
        assertThat(lower.deltaFor(true)).isEqualTo(-1);
        assertThat(lower.deltaFor(false)).isEqualTo(-2);
        assertThat(bridge.deltaFor(true)).isEqualTo(1);
        assertThat(bridge.deltaFor(false)).isEqualTo(-1);
    }

    @Test
    void render_shouldUseDigitsForOddAndLettersForEven() {
        assertThat(OutputInstruction.render(1)).isEqualTo('1');
        assertThat(OutputInstruction.render(2)).isEqualTo('B');
        assertThat(OutputInstruction.render(3)).isEqualTo('3');
        assertThat(OutputInstruction.render(4)).isEqualTo('D');
        assertThat(OutputInstruction.render(5)).isEqualTo('5');
        assertThat(OutputInstruction.render(6)).isEqualTo('F');
    }
}
