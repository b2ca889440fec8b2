package org.bloop.cli.flavor;

import org.bloop.runtime.spi.IRandomProvider;

import java.util.List;

/**
 * The message tables behind BLOOP's cosmetic output.
 * <p>
 * Each table draws from its own sub-stream of the injected {@link IRandomProvider}, so the
 * order in which messages are requested from different tables does not affect each other.
 * </p>
 */
public final class FlavorText {

    public static final List<String> SNARKY_MESSAGES = List.of(
            "The die judges you silently.",
            "Was that supposed to do something?",
            "Even the accumulator is confused.",
            "BLOOP disapproves.",
            "That's not how dice work, but ok.",
            "Your code has the energy of a wet sock.",
            "The die has seen better programs.",
            "Somewhere, a computer scientist just cried.");

    public static final List<String> STEP_LIMIT_LAMENTS = List.of(
            "I gave you a million steps and THIS is what you do?",
            "Congratulations, you've created nothing.",
            "Even the die is tired of rolling.",
            "Infinity called. It wants its loop back.",
            "Your program ran longer than your attention span.",
            "The accumulator begs for mercy.",
            "Did you really think this would terminate?",
            "Step limit reached. Hope was lost long ago.");

    public static final List<String> ZEN_KOANS = List.of(
            "The unrolled die contains all faces.",
            "In emptiness, the accumulator finds peace.",
            "To BLOOP nothing is to BLOOP everything.",
            "The blank program has already finished. Have you?",
            "No commands, no bugs. Perfection.",
            "The wisest BLOOP program is the one never written.");

    public static final List<String> EXISTENTIAL_SUFFIXES = List.of(
            " (but does it matter?)",
            " (in the grand scheme of things)",
            " (or so the die claims)",
            " (if you even believe in numbers)",
            " (the void stares back)",
            " (temporarily)");

    public static final String RICK_ROLL = String.join(System.lineSeparator(),
            "Never gonna give you up",
            "Never gonna let you down",
            "Never gonna run around and desert you",
            "Never gonna make you cry",
            "Never gonna say goodbye",
            "Never gonna tell a lie and hurt you");

    public static final String BLAME = "It's not a bug, it's a BLOOP.";

    public static final String KONAMI_BONUS = "+30 lives! Step limit doubled.";

    private final IRandomProvider snarkRandom;
    private final IRandomProvider lamentRandom;
    private final IRandomProvider koanRandom;
    private final IRandomProvider existentialRandom;

    /**
     * Creates the message tables.
     * @param random The root randomness source.
     */
    public FlavorText(IRandomProvider random) {
        this.snarkRandom = random.deriveFor("snark", 0);
        this.lamentRandom = random.deriveFor("lament", 0);
        this.koanRandom = random.deriveFor("koan", 0);
        this.existentialRandom = random.deriveFor("existential", 0);
    }

    public String snark() {
        return pick(SNARKY_MESSAGES, snarkRandom);
    }

    public String stepLimitLament() {
        return pick(STEP_LIMIT_LAMENTS, lamentRandom);
    }

    public String zenKoan() {
        return pick(ZEN_KOANS, koanRandom);
    }

    public String existentialSuffix() {
        return pick(EXISTENTIAL_SUFFIXES, existentialRandom);
    }

    private static String pick(List<String> table, IRandomProvider random) {
        return table.get(random.nextInt(table.size()));
    }
}
