package dev.jiff.config;

import dev.jiff.cli.CliArguments;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} by layering CLI arguments over environment variables over defaults.
 */
public class ConfigLoader {

    static final String ENV_NO_COLOR = "NO_COLOR";
    static final String ENV_COLUMNS = "COLUMNS";
    static final String ENV_CONTEXT = "JIFF_CONTEXT";
    static final String ENV_MAX_ALIGN_CELLS = "JIFF_MAX_ALIGN_CELLS";
    static final String ENV_DEBUG = "JIFF_DEBUG";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    static final int DEFAULT_TERMINAL_WIDTH = 120;
    static final int DEFAULT_CONTEXT = 0;
    static final long DEFAULT_MAX_ALIGN_CELLS = 1_000_000L;

    private final EnvironmentReader environmentReader;
    private final TerminalSizeProvider terminalSizeProvider;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this(environmentReader, new JLineTerminalSizeProvider());
    }

    public ConfigLoader(EnvironmentReader environmentReader, TerminalSizeProvider terminalSizeProvider) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
        this.terminalSizeProvider = Objects.requireNonNull(terminalSizeProvider, "terminalSizeProvider");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        DiffInputs inputs = resolveInputs(arguments.files(), arguments.gitDiff());
        boolean color = !arguments.noColor() && environmentReader.getTrimmed(ENV_NO_COLOR).isEmpty();
        int context = resolveInt(arguments.context(), "--context", ENV_CONTEXT, DEFAULT_CONTEXT, 0);
        int terminalWidth = resolveTerminalWidth(arguments.width(), arguments.sideBySide());
        long maxAlignCells = resolveMaxAlignCells(arguments.maxAlignCells());
        LogFormat logFormat = resolveLogFormat(arguments);
        boolean debug = arguments.debug() || environmentReader.getTrimmed(ENV_DEBUG)
                .map(value -> value.equals("1") || value.equalsIgnoreCase("true"))
                .orElse(false);

        return new Config(inputs, arguments.gitDiff(), Layout.of(arguments.sideBySide()), color, context,
                terminalWidth, maxAlignCells, logFormat, debug);
    }

    /**
     * Plain mode takes exactly two files. Git mode also accepts the 7 arguments git passes to an
     * external diff driver ({@code path old-file old-hex old-mode new-file new-hex new-mode}) and the 9
     * it passes for renames, which append {@code new-path similarity}.
     */
    private DiffInputs resolveInputs(List<String> files, boolean gitDiff) {
        int count = files == null ? 0 : files.size();
        if (count == 2) {
            return new DiffInputs(Path.of(files.get(0)), Path.of(files.get(1)), files.get(0), files.get(1));
        }
        if (!gitDiff) {
            throw new IllegalArgumentException("Expected exactly two files but got " + count);
        }
        if (count != 7 && count != 9) {
            throw new IllegalArgumentException("--git-diff expects 2, 7 or 9 arguments but got " + count);
        }
        String oldPath = files.get(0);
        String newPath = count == 9 ? files.get(7) : oldPath;
        return new DiffInputs(Path.of(files.get(1)), Path.of(files.get(4)), "a/" + oldPath, "b/" + newPath);
    }

    private int resolveInt(Integer cliValue, String optionName, String envKey, int defaultValue, int minimum) {
        if (cliValue != null) {
            return requireAtLeast(cliValue, minimum, optionName);
        }
        return environmentReader.getTrimmed(envKey)
                .map(raw -> requireAtLeast(parseInteger(raw, envKey), minimum, envKey))
                .orElse(defaultValue);
    }

    /**
     * {@code --width}, then {@code COLUMNS}, then the attached terminal, then the default. Only the
     * side-by-side layout queries the terminal.
     */
    private int resolveTerminalWidth(Integer cliValue, boolean sideBySide) {
        if (cliValue != null) {
            return requireAtLeast(cliValue, 1, "--width");
        }
        Optional<String> columns = environmentReader.getTrimmed(ENV_COLUMNS);
        if (columns.isPresent()) {
            return requireAtLeast(parseInteger(columns.get(), ENV_COLUMNS), 1, ENV_COLUMNS);
        }
        if (!sideBySide) {
            return DEFAULT_TERMINAL_WIDTH;
        }
        return terminalSizeProvider.width().orElse(DEFAULT_TERMINAL_WIDTH);
    }

    private long resolveMaxAlignCells(Long cliValue) {
        if (cliValue != null) {
            if (cliValue <= 0) {
                throw new IllegalArgumentException("--max-align-cells must be greater than zero");
            }
            return cliValue;
        }
        return environmentReader.getTrimmed(ENV_MAX_ALIGN_CELLS)
                .map(raw -> {
                    long value = parseLong(raw, ENV_MAX_ALIGN_CELLS);
                    if (value <= 0) {
                        throw new IllegalArgumentException(ENV_MAX_ALIGN_CELLS + " must be greater than zero");
                    }
                    return value;
                })
                .orElse(DEFAULT_MAX_ALIGN_CELLS);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.getTrimmed(ENV_LOG_FORMAT)
                .map(value -> LogFormat.from(value.toLowerCase(Locale.ROOT)))
                .orElse(LogFormat.TEXT);
    }

    private static int requireAtLeast(int value, int minimum, String name) {
        if (value < minimum) {
            throw new IllegalArgumentException(name + " must be " + minimum + " or greater");
        }
        return value;
    }

    private static int parseInteger(String raw, String name) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer", ex);
        }
    }

    private static long parseLong(String raw, String name) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer", ex);
        }
    }
}
