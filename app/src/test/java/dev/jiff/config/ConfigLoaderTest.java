package dev.jiff.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import dev.jiff.cli.CliArguments;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void appliesDefaultsForTwoFiles() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "left.txt", "right.txt");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.inputs().left()).isEqualTo(Path.of("left.txt"));
        assertThat(config.inputs().right()).isEqualTo(Path.of("right.txt"));
        assertThat(config.inputs().leftLabel()).isEqualTo("left.txt");
        assertThat(config.gitDiff()).isFalse();
        assertThat(config.layout()).isEqualTo(Layout.UNIFIED);
        assertThat(config.color()).isTrue();
        assertThat(config.context()).isEqualTo(ConfigLoader.DEFAULT_CONTEXT);
        assertThat(config.terminalWidth()).isEqualTo(ConfigLoader.DEFAULT_TERMINAL_WIDTH);
        assertThat(config.maxAlignmentCells()).isEqualTo(ConfigLoader.DEFAULT_MAX_ALIGN_CELLS);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.debug()).isFalse();
    }

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--side-by-side",
                "--no-color",
                "--context", "3",
                "--width", "80",
                "--max-align-cells", "500",
                "--log-format", "json",
                "--debug",
                "a.txt", "b.txt");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.sideBySide()).isTrue();
        assertThat(config.color()).isFalse();
        assertThat(config.context()).isEqualTo(3);
        assertThat(config.terminalWidth()).isEqualTo(80);
        assertThat(config.maxAlignmentCells()).isEqualTo(500);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.debug()).isTrue();
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_NO_COLOR, "1",
                ConfigLoader.ENV_COLUMNS, " 100 ",
                ConfigLoader.ENV_CONTEXT, "2",
                ConfigLoader.ENV_MAX_ALIGN_CELLS, "42",
                ConfigLoader.ENV_DEBUG, "TRUE",
                ConfigLoader.ENV_LOG_FORMAT, "JSON"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "a.txt", "b.txt");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.color()).isFalse();
        assertThat(config.terminalWidth()).isEqualTo(100);
        assertThat(config.context()).isEqualTo(2);
        assertThat(config.maxAlignmentCells()).isEqualTo(42);
        assertThat(config.debug()).isTrue();
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(environmentReader.requestedKeys()).contains(ConfigLoader.ENV_COLUMNS, ConfigLoader.ENV_CONTEXT);
    }

    @Test
    void cliValuesOverrideEnvironment() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_COLUMNS, "100",
                ConfigLoader.ENV_CONTEXT, "2"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--width", "60", "-C", "0", "a.txt", "b.txt");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.terminalWidth()).isEqualTo(60);
        assertThat(config.context()).isZero();
        assertThat(environmentReader.requestedKeys())
                .doesNotContain(ConfigLoader.ENV_COLUMNS, ConfigLoader.ENV_CONTEXT);
    }

    @Test
    void blankNoColorKeepsColor() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "a.txt", "b.txt");

        Config config = new ConfigLoader(new RecordingEnvironmentReader(Map.of(ConfigLoader.ENV_NO_COLOR, "  ")))
                .load(cliArguments);

        assertThat(config.color()).isTrue();
    }

    @Test
    void gitModeReadsExternalDiffArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--git-diff",
                "docs/readme.md", "/tmp/old", "1111111", "100644", "/tmp/new", "2222222", "100644");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.gitDiff()).isTrue();
        assertThat(config.inputs().left()).isEqualTo(Path.of("/tmp/old"));
        assertThat(config.inputs().right()).isEqualTo(Path.of("/tmp/new"));
        assertThat(config.inputs().leftLabel()).isEqualTo("a/docs/readme.md");
        assertThat(config.inputs().rightLabel()).isEqualTo("b/docs/readme.md");
    }

    @Test
    void gitModeLabelsRenamesWithTheNewPath() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "-g",
                "old.md", "/tmp/old", "1111111", "100644", "/tmp/new", "2222222", "100644",
                "new.md", "similarity index 90%");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.inputs().leftLabel()).isEqualTo("a/old.md");
        assertThat(config.inputs().rightLabel()).isEqualTo("b/new.md");
    }

    @Test
    void gitModeStillAcceptsTwoFiles() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "-g", "x", "y");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.inputs().leftLabel()).isEqualTo("x");
        assertThat(config.inputs().rightLabel()).isEqualTo("y");
    }

    @Test
    void rejectsExtraFilesOutsideGitMode() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "a", "b", "c");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Expected exactly two files but got 3");
    }

    @Test
    void rejectsUnexpectedGitArgumentCount() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "-g", "a", "b", "c");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("2, 7 or 9");
    }

    @Test
    void rejectsMalformedEnvironmentNumbers() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "a", "b");

        Throwable notANumber = catchThrowable(() -> new ConfigLoader(
                new RecordingEnvironmentReader(Map.of(ConfigLoader.ENV_COLUMNS, "wide"))).load(cliArguments));
        Throwable negative = catchThrowable(() -> new ConfigLoader(
                new RecordingEnvironmentReader(Map.of(ConfigLoader.ENV_CONTEXT, "-1"))).load(cliArguments));
        Throwable zeroCells = catchThrowable(() -> new ConfigLoader(
                new RecordingEnvironmentReader(Map.of(ConfigLoader.ENV_MAX_ALIGN_CELLS, "0"))).load(cliArguments));

        assertThat(notANumber).isInstanceOf(IllegalArgumentException.class).hasMessage("COLUMNS must be an integer");
        assertThat(negative).isInstanceOf(IllegalArgumentException.class).hasMessage("JIFF_CONTEXT must be 0 or greater");
        assertThat(zeroCells).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("greater than zero");
    }

    @Test
    void rejectsOutOfRangeCliNumbers() {
        CliArguments zeroWidth = CommandLine.populateCommand(new CliArguments(), "--width", "0", "a", "b");
        CliArguments zeroCells = CommandLine.populateCommand(new CliArguments(), "--max-align-cells", "0", "a", "b");
        ConfigLoader loader = new ConfigLoader(key -> Optional.empty());

        assertThat(catchThrowable(() -> loader.load(zeroWidth)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("--width must be 1 or greater");
        assertThat(catchThrowable(() -> loader.load(zeroCells)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("--max-align-cells must be greater than zero");
    }

    @Test
    void acceptsLargestIntegerContext() {
        CliArguments fromCli = CommandLine.populateCommand(new CliArguments(), "--context", "2147483647", "a", "b");
        CliArguments fromEnv = CommandLine.populateCommand(new CliArguments(), "a", "b");

        Config cliConfig = new ConfigLoader(key -> Optional.empty(), TerminalSizeProvider.NONE).load(fromCli);
        Config envConfig = new ConfigLoader(new RecordingEnvironmentReader(Map.of(ConfigLoader.ENV_CONTEXT, "2147483647")),
                TerminalSizeProvider.NONE).load(fromEnv);

        assertThat(cliConfig.context()).isEqualTo(Integer.MAX_VALUE);
        assertThat(envConfig.context()).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void rejectsContextBeyondIntegerRange() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "a", "b");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(
                new RecordingEnvironmentReader(Map.of(ConfigLoader.ENV_CONTEXT, "2147483648")),
                TerminalSizeProvider.NONE).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessage("JIFF_CONTEXT must be an integer");
    }

    @Test
    void sideBySideFallsBackToTerminalWidth() {
        CountingTerminal terminal = new CountingTerminal(OptionalInt.of(95));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "-s", "a", "b");

        Config config = new ConfigLoader(key -> Optional.empty(), terminal).load(cliArguments);

        assertThat(config.terminalWidth()).isEqualTo(95);
        assertThat(terminal.queries).isEqualTo(1);
    }

    @Test
    void widthOptionAndColumnsTakePrecedenceOverTerminal() {
        CountingTerminal terminal = new CountingTerminal(OptionalInt.of(95));
        CliArguments withWidth = CommandLine.populateCommand(new CliArguments(), "-s", "--width", "70", "a", "b");
        CliArguments withoutWidth = CommandLine.populateCommand(new CliArguments(), "-s", "a", "b");

        Config fromCli = new ConfigLoader(key -> Optional.empty(), terminal).load(withWidth);
        Config fromEnv = new ConfigLoader(new RecordingEnvironmentReader(Map.of(ConfigLoader.ENV_COLUMNS, "100")),
                terminal).load(withoutWidth);

        assertThat(fromCli.terminalWidth()).isEqualTo(70);
        assertThat(fromEnv.terminalWidth()).isEqualTo(100);
        assertThat(terminal.queries).isZero();
    }

    @Test
    void missingTerminalSizeUsesDefaultWidth() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "-s", "a", "b");

        Config config = new ConfigLoader(key -> Optional.empty(), TerminalSizeProvider.NONE).load(cliArguments);

        assertThat(config.terminalWidth()).isEqualTo(ConfigLoader.DEFAULT_TERMINAL_WIDTH);
    }

    @Test
    void unifiedLayoutDoesNotQueryTerminal() {
        CountingTerminal terminal = new CountingTerminal(OptionalInt.of(95));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "a", "b");

        Config config = new ConfigLoader(key -> Optional.empty(), terminal).load(cliArguments);

        assertThat(config.terminalWidth()).isEqualTo(ConfigLoader.DEFAULT_TERMINAL_WIDTH);
        assertThat(terminal.queries).isZero();
    }

    @Test
    void rejectsUnknownLogFormatInEnvironment() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "a", "b");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(
                new RecordingEnvironmentReader(Map.of(ConfigLoader.ENV_LOG_FORMAT, "xml"))).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("xml");
    }

    private static final class CountingTerminal implements TerminalSizeProvider {

        private final OptionalInt width;
        private int queries;

        private CountingTerminal(OptionalInt width) {
            this.width = width;
        }

        @Override
        public OptionalInt width() {
            queries++;
            return width;
        }
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
