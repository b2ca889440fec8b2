package org.bloop.cli.flavor;

import org.bloop.runtime.spi.IExecutionListener;

import java.io.PrintWriter;

/**
 * Turns interpreter notifications into flavor text.
 * <ul>
 *   <li>In existential mode every output character is followed by a random suffix in the
 *       rendered text. The interpreter's own output stays untouched.</li>
 *   <li>With snark enabled, every pass over a '!' prints a random snarky message to stderr.</li>
 * </ul>
 */
public class CommentaryListener implements IExecutionListener {

    /**
     * The inert character that triggers a snarky message.
     */
    public static final char SNARK_SYMBOL = '!';

    private final FlavorText flavorText;
    private final PrintWriter err;
    private final boolean existential;
    private final boolean snark;
    private final StringBuilder rendered = new StringBuilder();

    public CommentaryListener(FlavorText flavorText, PrintWriter err, boolean existential, boolean snark) {
        this.flavorText = flavorText;
        this.err = err;
        this.existential = existential;
        this.snark = snark;
    }

    @Override
    public void onOutput(char symbol, int position) {
        rendered.append(symbol);
        if (existential) {
            rendered.append(flavorText.existentialSuffix());
        }
    }

    @Override
    public void onInertCharacter(char symbol, int position) {
        if (snark && symbol == SNARK_SYMBOL) {
            err.println(flavorText.snark());
            err.flush();
        }
    }

    /**
     * Returns the text to show the user.
     * @return The output with existential suffixes when that mode is on, the plain output otherwise.
     */
    public String getRenderedOutput() {
        return rendered.toString();
    }
}
