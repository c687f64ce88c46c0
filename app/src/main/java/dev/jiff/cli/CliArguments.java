package dev.jiff.cli;

import dev.jiff.config.LogFormat;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "jiff", mixinStandardHelpOptions = true, version = "jiff 0.1.0",
        description = "Colored diff tool with line alignment and character highlighting")
public class CliArguments {

    @CommandLine.Option(names = {"-g", "--git-diff"}, description = "Enable git diff mode (accepts git's external diff arguments)")
    private boolean gitDiff;

    @CommandLine.Option(names = {"-s", "--side-by-side"}, description = "Enable side-by-side diffing")
    private boolean sideBySide;

    @CommandLine.Option(names = "--no-color", description = "Disables colorization of the output")
    private boolean noColor;

    @CommandLine.Option(names = {"-C", "--context"}, description = "Unchanged lines kept around each change; 0 shows everything", paramLabel = "LINES")
    private Integer context;

    @CommandLine.Option(names = "--width", description = "Terminal width used for side-by-side layout", paramLabel = "COLUMNS")
    private Integer width;

    @CommandLine.Option(names = "--max-align-cells", description = "Largest before x after line product aligned per replace block", paramLabel = "CELLS")
    private Long maxAlignCells;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--debug", description = "Log diff chunks and alignment details to stderr")
    private boolean debug;

    @CommandLine.Parameters(arity = "2..*", paramLabel = "FILE", description = "Left and right file, or git's external diff arguments with --git-diff")
    private List<String> files = new ArrayList<>();

    public boolean gitDiff() {
        return gitDiff;
    }

    public boolean sideBySide() {
        return sideBySide;
    }

    public boolean noColor() {
        return noColor;
    }

    public Integer context() {
        return context;
    }

    public Integer width() {
        return width;
    }

    public Long maxAlignCells() {
        return maxAlignCells;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean debug() {
        return debug;
    }

    public List<String> files() {
        return files;
    }
}
