package org.bloop.cli.flavor;

import java.time.Duration;
import java.util.Locale;

/**
 * Measures a run and judges it.
 */
public final class SpeedrunTimer {

    private final long startNanos;

    private SpeedrunTimer(long startNanos) {
        this.startNanos = startNanos;
    }

    public static SpeedrunTimer start() {
        return new SpeedrunTimer(System.nanoTime());
    }

    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * Builds the line printed after a speedrun.
     * @param elapsed The measured duration.
     * @return The formatted time followed by the verdict.
     */
    public static String report(Duration elapsed) {
        return "⏱  " + format(elapsed) + " - " + verdict(elapsed);
    }

    /**
     * Picks the verdict for a duration.
     * @param elapsed The measured duration.
     * @return The comment.
     */
    public static String verdict(Duration elapsed) {
        long micros = elapsed.toNanos() / 1_000;
        long millis = elapsed.toMillis();
        if (micros < 100) {
            return "was that a run or a rumor?";
        } else if (micros < 1_000) {
            return "blink and you missed it";
        } else if (millis < 10) {
            return "faster than your wifi";
        } else if (millis < 100) {
            return "not bad, not bad";
        } else if (millis == 420) {
            return "nice.";
        } else if (millis < 1_000) {
            return "the die took a scenic route";
        }
        return "are you running this on a potato?";
    }

    /**
     * Formats a duration with a unit matching its magnitude.
     * @param elapsed The duration.
     * @return e.g. "85µs", "3.250ms" or "1.500s".
     */
    public static String format(Duration elapsed) {
        long nanos = elapsed.toNanos();
        if (nanos < 1_000_000L) {
            return (nanos / 1_000) + "µs";
        } else if (nanos < 1_000_000_000L) {
            return String.format(Locale.ROOT, "%.3fms", nanos / 1_000_000.0);
        }
        return String.format(Locale.ROOT, "%.3fs", nanos / 1_000_000_000.0);
    }
}
