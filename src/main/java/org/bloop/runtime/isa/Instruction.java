package org.bloop.runtime.isa;

import org.bloop.runtime.internal.services.ExecutionContext;
import org.bloop.runtime.isa.instructions.AccumulatorInstruction;
import org.bloop.runtime.isa.instructions.LoopInstruction;
import org.bloop.runtime.isa.instructions.OutputInstruction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The abstract base class for all BLOOP instructions.
 * <p>
 * Each command character maps to exactly one stateless instruction instance held in a static
 * registry. Characters without a registered instruction are inert.
 * </p>
 */
public abstract class Instruction {

    protected final char symbol;
    private final String name;

    // Runtime Registry
    private static final Map<Character, Instruction> REGISTERED_INSTRUCTIONS_BY_SYMBOL = new LinkedHashMap<>();

    static {
        register(new AccumulatorInstruction('B', "RAISE"));
        register(new AccumulatorInstruction('L', "LOWER"));
        register(new OutputInstruction('O', "OUTPUT"));
        register(new AccumulatorInstruction('P', "BRIDGE"));
        register(new LoopInstruction('(', "LOOP_OPEN"));
        register(new LoopInstruction(')', "LOOP_CLOSE"));
    }

    /**
     * Constructs a new instruction.
     * @param symbol The command character.
     * @param name The mnemonic used in diagnostics.
     */
    protected Instruction(char symbol, String name) {
        this.symbol = symbol;
        this.name = name;
    }

    /**
     * Executes this instruction against the state of a run. The instruction may mutate the
     * accumulator, emit output, touch the loop stack or move the cursor; the caller advances
     * the cursor afterwards unless the instruction jumped.
     *
     * @param context The state of the current run.
     */
    public abstract void execute(ExecutionContext context);

    private static void register(Instruction instruction) {
        Instruction previous = REGISTERED_INSTRUCTIONS_BY_SYMBOL.putIfAbsent(instruction.getSymbol(), instruction);
        if (previous != null) {
            throw new IllegalStateException("Duplicate instruction for symbol '" + instruction.getSymbol() + "'");
        }
    }

    /**
     * Looks up the instruction for a character.
     * @param symbol The character under the cursor.
     * @return The instruction, or {@code null} if the character is inert.
     */
    public static Instruction getBySymbol(char symbol) {
        return REGISTERED_INSTRUCTIONS_BY_SYMBOL.get(symbol);
    }

    /**
     * Looks up an instruction by its mnemonic.
     * @param name The mnemonic, e.g. "RAISE".
     * @return An Optional containing the instruction if found.
     */
    public static Optional<Instruction> getByName(String name) {
        return REGISTERED_INSTRUCTIONS_BY_SYMBOL.values().stream()
                .filter(instruction -> instruction.getName().equalsIgnoreCase(name))
                .findFirst();
    }

    /**
     * Checks whether a character is a command.
     * @param symbol The character to check.
     * @return true if an instruction is registered for it.
     */
    public static boolean isCommand(char symbol) {
        return REGISTERED_INSTRUCTIONS_BY_SYMBOL.containsKey(symbol);
    }

    /**
     * Checks whether a text contains at least one command character.
     * @param source The text to scan.
     * @return true if any character is a command.
     */
    public static boolean containsCommand(CharSequence source) {
        for (int i = 0; i < source.length(); i++) {
            if (isCommand(source.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns all registered instructions in registration order.
     * @return An unmodifiable view keyed by symbol.
     */
    public static Map<Character, Instruction> getInstructionSet() {
        return Collections.unmodifiableMap(REGISTERED_INSTRUCTIONS_BY_SYMBOL);
    }

    public char getSymbol() {
        return symbol;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name + "('" + symbol + "')";
    }
}
