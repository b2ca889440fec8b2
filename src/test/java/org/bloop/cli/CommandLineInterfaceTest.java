package org.bloop.cli;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.ConfigFactory;
import org.bloop.cli.config.LoggingConfigurator;
import org.bloop.cli.flavor.FlavorText;
import org.bloop.junit.extensions.logging.AllowLog;
import org.bloop.junit.extensions.logging.FailOnLog;
import org.bloop.junit.extensions.logging.LogLevel;
import org.bloop.junit.extensions.logging.LogWatchExtension;
import org.bloop.runtime.internal.services.SeededRandomProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        ConfigFactory.invalidateCaches();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() throws JoranException {
        LoggingConfigurator.reset();
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
        if (rootLogger().getAppender(LoggingConfigurator.PLAIN_APPENDER) == null) {
            LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(getClass().getClassLoader().getResource("logback.xml"));
        }
    }

    private static Logger rootLogger() {
        return ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(Logger.ROOT_LOGGER_NAME);
    }

    private int execute(String... args) {
        CommandLine commandLine = new CommandLine(new CommandLineInterface(new SeededRandomProvider(1L)));
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private Path writeFile(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void inlineCode_shouldPrintOutputWithoutTrailingNewline() {
        int exitCode = execute("-c", "OBOBO");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).isEqualTo("1BD");
    }

    @Test
    void programFile_shouldRun() throws IOException {
        Path program = writeFile("loop.bloop", "B(B)O\n");

        int exitCode = execute(program.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).isEqualTo("F");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void programFile_withOtherExtension_shouldWarnAndRun() throws IOException {
        Path program = writeFile("hello.txt", "O");

        int exitCode = execute(program.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).isEqualTo("1");
        assertThat(err.toString()).contains("does not have a .bloop extension");
    }

    @Test
    void missingFile_shouldFailWithExitCodeOne() {
        int exitCode = execute(tempDir.resolve("nope.bloop").toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_ERROR);
        assertThat(err.toString())
                .startsWith("error reading file: no such file")
                .contains("nope.bloop")
                .doesNotContain("Exception");
    }

    @Test
    void noSource_shouldPrintUsage() {
        int exitCode = execute();

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_ERROR);
        assertThat(err.toString()).contains("error: no BLOOP code provided").contains("Usage: bloop");
    }

    @Test
    void codeAndFile_shouldPreferCode() throws IOException {
        Path program = writeFile("ignored.bloop", "BO");

        int exitCode = execute("-c", "O", program.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).isEqualTo("1");
        assertThat(err.toString()).contains("ignoring file");
    }

    @Test
    void infiniteLoop_shouldExitWithCodeTwoAndKeepOutput() {
        int exitCode = execute("-c", "O(B)", "-m", "100");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_STEP_LIMIT);
        assertThat(out.toString()).isEqualTo("1");
        assertThat(err.toString()).contains("step limit reached (100 steps)");
        assertThat(FlavorText.STEP_LIMIT_LAMENTS).anyMatch(lament -> err.toString().contains(lament));
    }

    @Test
    void nonPositiveMaxSteps_shouldBeRejected() {
        int exitCode = execute("-c", "O", "--max-steps", "0");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_ERROR);
        assertThat(err.toString()).contains("must be a positive integer");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void nonNumericMaxSteps_shouldFailWithExitCodeOne() {
        int exitCode = execute("-c", "O", "-m", "abc");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_ERROR);
        assertThat(err.toString()).contains("'abc'").contains("Usage: bloop");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void unknownOption_shouldFailWithExitCodeOne() {
        int exitCode = execute("-c", "O", "--turbo");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_ERROR);
        assertThat(err.toString()).contains("Unknown option").contains("--turbo");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void programWithoutCommands_shouldServeAKoan() {
        int exitCode = execute("-c", "just words here");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(FlavorText.ZEN_KOANS).contains(out.toString().strip());
    }

    @Test
    void konamiSequence_shouldDoubleTheStepLimit() {
        int exitCode = execute("-c", "BBLLBBLLP(B)", "-m", "50");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_STEP_LIMIT);
        assertThat(err.toString()).contains(FlavorText.KONAMI_BONUS).contains("step limit reached (100 steps)");
    }

    @Test
    void bang_shouldPrintSnarkToStderr() {
        int exitCode = execute("-c", "!O");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).isEqualTo("1");
        assertThat(FlavorText.SNARKY_MESSAGES).contains(err.toString().strip());
    }

    @Test
    void existential_shouldAppendSuffixAfterEachOutput() {
        int exitCode = execute("-c", "O", "--existential");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).startsWith("1 (");
        assertThat(FlavorText.EXISTENTIAL_SUFFIXES).contains(out.toString().substring(1));
    }

    @Test
    void speedrun_shouldReportElapsedTime() {
        int exitCode = execute("-c", "O", "--speedrun");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(err.toString()).contains("⏱");
    }

    @Test
    void rick_shouldPrintLyrics() {
        assertThat(execute("--rick")).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).startsWith("Never gonna give you up");
    }

    @Test
    void blame_shouldDeflect() {
        assertThat(execute("--blame")).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString().strip()).isEqualTo(FlavorText.BLAME);
    }

    @Test
    @FailOnLog(level = LogLevel.INFO)
    @AllowLog(level = LogLevel.INFO, loggerPattern = ".*ConfigLoader", messagePattern = "Using configuration file specified via --config: .*custom\\.conf")
    @AllowLog(level = LogLevel.INFO, loggerPattern = ".*CommandLineInterface", messagePattern = "Run ended with STEP_LIMIT_EXCEEDED after 10 of 10 steps\\.")
    void configFile_shouldSetStepLimit() throws IOException {
        Path config = writeFile("custom.conf", "bloop.max-steps = 10\n");

        int exitCode = execute("-c", "(B)", "--config", config.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_STEP_LIMIT);
        assertThat(err.toString()).contains("step limit reached (10 steps)");
    }

    @Test
    void configFile_withJsonLogging_shouldAttachJsonAppender() throws IOException {
        Path config = writeFile("json.conf", "logging.format = \"JSON\"\n");

        int exitCode = execute("-c", "O", "--config", config.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).isEqualTo("1");
        assertThat(rootLogger().getAppender(LoggingConfigurator.JSON_APPENDER)).isNotNull();
        assertThat(rootLogger().getAppender(LoggingConfigurator.PLAIN_APPENDER)).isNull();
    }

    @Test
    void configFile_canDisableEasterEggs() throws IOException {
        Path config = writeFile("quiet.conf", "bloop.easter-eggs.enabled = false\n");

        int exitCode = execute("-c", "no commands!", "--config", config.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void invalidConfig_shouldFailWithExitCodeOne() throws IOException {
        Path config = writeFile("broken.conf", "bloop.max-steps = -1\n");

        int exitCode = execute("-c", "O", "--config", config.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_ERROR);
        assertThat(err.toString()).contains("error: invalid configuration");
    }

    @Test
    void missingConfigFile_shouldFailWithExitCodeOne() {
        int exitCode = execute("-c", "O", "--config", tempDir.resolve("absent.conf").toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_ERROR);
        assertThat(err.toString()).contains("error: invalid configuration");
    }
}
