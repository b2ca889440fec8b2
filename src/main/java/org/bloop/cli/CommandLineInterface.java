package org.bloop.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.bloop.cli.config.BloopSettings;
import org.bloop.cli.config.ConfigLoader;
import org.bloop.cli.config.LoggingConfigurator;
import org.bloop.cli.flavor.CommentaryListener;
import org.bloop.cli.flavor.FlavorText;
import org.bloop.cli.flavor.SpeedrunTimer;
import org.bloop.runtime.ExecutionResult;
import org.bloop.runtime.Interpreter;
import org.bloop.runtime.internal.services.SeededRandomProvider;
import org.bloop.runtime.isa.Instruction;
import org.bloop.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

@Command(
    name = "bloop",
    mixinStandardHelpOptions = true,
    version = "BLOOP 1.0",
    description = "Runs BLOOP programs: one accumulator, six faces, no mercy.",
    exitCodeOnInvalidInput = CommandLineInterface.EXIT_ERROR,
    footer = {
        "",
        "Examples:",
        "  bloop examples/hello.bloop",
        "  bloop -c \"BBOOO\"",
        "  bloop -m 500000 examples/hello.bloop"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_STEP_LIMIT = 2;

    @Parameters(index = "0", arity = "0..1", paramLabel = "FILE", description = "A .bloop program file.")
    private Path file;

    @Option(names = {"-c", "--code"}, description = "Run inline BLOOP code instead of a file.")
    private String code;

    @Option(names = {"-m", "--max-steps"}, paramLabel = "N", description = "Step limit (default: bloop.max-steps, 1000000).")
    private Integer maxSteps;

    @Option(names = "--existential", description = "Enable existential commentary.")
    private boolean existential;

    @Option(names = "--speedrun", description = "Race the die.")
    private boolean speedrun;

    @Option(names = "--rick", description = "You know what this does.")
    private boolean rick;

    @Option(names = "--blame", description = "It's not a bug.")
    private boolean blame;

    @Option(names = "--config", paramLabel = "FILE", description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ").")
    private File configFile;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final IRandomProvider random;

    public CommandLineInterface() {
        this(null);
    }

    /**
     * Creates the command with a fixed randomness source.
     * @param random The source for flavor text, or {@code null} to seed one from the configuration.
     */
    public CommandLineInterface(IRandomProvider random) {
        this.random = random;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        if (rick) {
            out.println(FlavorText.RICK_ROLL);
            out.flush();
            return EXIT_OK;
        }
        if (blame) {
            out.println(FlavorText.BLAME);
            out.flush();
            return EXIT_OK;
        }

        final BloopSettings settings;
        try {
            final Config config = ConfigLoader.load(configFile, new File(ConfigLoader.CONFIG_FILE_NAME));
            LoggingConfigurator.configure(config);
            settings = BloopSettings.fromConfig(config);
        } catch (ConfigException e) {
            err.println("error: invalid configuration: " + e.getMessage());
            err.flush();
            return EXIT_ERROR;
        }

        if (maxSteps != null && maxSteps <= 0) {
            err.printf("error: --max-steps value must be a positive integer, got %d%n", maxSteps);
            err.flush();
            return EXIT_ERROR;
        }

        final String source;
        try {
            source = resolveSource(settings, err);
        } catch (IOException e) {
            err.println("error reading file: " + describe(e));
            err.flush();
            return EXIT_ERROR;
        }

        if (source.isEmpty()) {
            err.println("error: no BLOOP code provided");
            spec.commandLine().usage(err);
            err.flush();
            return EXIT_ERROR;
        }

        final FlavorText flavorText = new FlavorText(randomFor(settings));
        final boolean easterEggs = settings.isEasterEggsEnabled();

        if (easterEggs && !Instruction.containsCommand(source) && source.indexOf(CommentaryListener.SNARK_SYMBOL) < 0) {
            LOGGER.debug("Program contains no commands, serving a koan instead.");
            out.println(flavorText.zenKoan());
            out.flush();
            return EXIT_OK;
        }

        int ceiling = maxSteps != null ? maxSteps : settings.getMaxSteps();
        if (easterEggs && source.contains(settings.getKonamiSequence())) {
            ceiling = ceiling > Integer.MAX_VALUE / 2 ? Integer.MAX_VALUE : ceiling * 2;
            err.println(FlavorText.KONAMI_BONUS);
        }

        final CommentaryListener listener = new CommentaryListener(flavorText, err, existential, easterEggs);
        final SpeedrunTimer timer = SpeedrunTimer.start();
        final ExecutionResult result = new Interpreter(ceiling, listener).run(source);
        final Duration elapsed = timer.elapsed();
        LOGGER.info("Run ended with {} after {} of {} steps.", result.termination(), result.steps(), result.maxSteps());

        out.print(listener.getRenderedOutput());
        out.flush();

        if (speedrun) {
            err.println();
            err.println(SpeedrunTimer.report(elapsed));
        }

        if (result.isStepLimitExceeded()) {
            err.println();
            err.println(flavorText.stepLimitLament());
            err.printf("step limit reached (%d steps)%n", result.maxSteps());
            err.flush();
            return EXIT_STEP_LIMIT;
        }
        err.flush();
        return EXIT_OK;
    }

    private String resolveSource(final BloopSettings settings, final PrintWriter err) throws IOException {
        if (code != null) {
            if (file != null) {
                err.printf("notice: --code given, ignoring file \"%s\"%n", file);
            }
            return code;
        }
        if (file == null) {
            return "";
        }
        if (!ProgramSourceLoader.hasExtension(file, settings.getSourceExtension())) {
            err.printf("warning: file \"%s\" does not have a %s extension%n", file, settings.getSourceExtension());
        }
        LOGGER.debug("Reading program from {}", file.toAbsolutePath());
        return ProgramSourceLoader.read(file);
    }

    private static String describe(final IOException e) {
        if (e instanceof NoSuchFileException missing) {
            return "no such file \"" + missing.getFile() + "\"";
        }
        if (e instanceof AccessDeniedException denied) {
            return "permission denied \"" + denied.getFile() + "\"";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private IRandomProvider randomFor(final BloopSettings settings) {
        if (random != null) {
            return random;
        }
        final Long seed = settings.getFlavorSeed();
        return new SeededRandomProvider(seed != null ? seed : System.nanoTime());
    }
}
