package dev.jiff.cli;

import dev.jiff.align.EditProfileCostModel;
import dev.jiff.align.LineAligner;
import dev.jiff.config.Config;
import dev.jiff.config.ConfigLoader;
import dev.jiff.config.SystemEnvironmentReader;
import dev.jiff.diff.DiffCalculator;
import dev.jiff.diff.DiffChunk;
import dev.jiff.io.DocumentReadException;
import dev.jiff.io.DocumentReader;
import dev.jiff.logging.LoggingConfigurator;
import dev.jiff.render.CharacterHighlighter;
import dev.jiff.render.DiffRenderer;
import dev.jiff.render.Palette;
import dev.jiff.render.ReplaceBlockAligner;
import dev.jiff.render.SideBySideDiffRenderer;
import dev.jiff.render.UnifiedDiffRenderer;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration, diff calculation and rendering.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_READ_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final DocumentReader documentReader;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new DocumentReader(),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true),
                new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8), true));
    }

    CliApplication(ConfigLoader configLoader, DocumentReader documentReader, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.documentReader = documentReader;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            if (commandLine.isUsageHelpRequested()) {
                commandLine.usage(out);
                return commandLine.getCommandSpec().exitCodeOnUsageHelp();
            }
            return reportInvalidInput(commandLine, ex.getMessage());
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            return reportInvalidInput(commandLine, ex.getMessage());
        }
        LoggingConfigurator.configure(config.logFormat(), config.debug());
        LOGGER.debug("Comparing {} with {} ({} layout, color={}, context={})",
                config.inputs().left(), config.inputs().right(), config.layout(), config.color(), config.context());

        String left;
        String right;
        try {
            left = documentReader.read(config.inputs().left());
            right = documentReader.read(config.inputs().right());
        } catch (DocumentReadException ex) {
            err.println(ex.getMessage());
            err.flush();
            return EXIT_READ_FAILURE;
        }

        DiffCalculator diffCalculator = new DiffCalculator();
        List<DiffChunk> chunks = diffCalculator.calculateLineDiff(left, right);
        DiffRenderer renderer = createRenderer(config, diffCalculator);
        if (config.gitDiff()) {
            renderer.renderHeader(config.inputs().leftLabel(), config.inputs().rightLabel(), out);
        }
        renderer.render(chunks, out);
        return EXIT_OK;
    }

    private int reportInvalidInput(CommandLine commandLine, String message) {
        err.println(message);
        commandLine.usage(err);
        err.flush();
        return commandLine.getCommandSpec().exitCodeOnInvalidInput();
    }

    static DiffRenderer createRenderer(Config config, DiffCalculator diffCalculator) {
        LineAligner lineAligner = new LineAligner(new EditProfileCostModel(diffCalculator), config.debug());
        ReplaceBlockAligner aligner = new ReplaceBlockAligner(lineAligner, config.maxAlignmentCells());
        CharacterHighlighter highlighter = new CharacterHighlighter(diffCalculator);
        return switch (config.layout()) {
            case SIDE_BY_SIDE -> new SideBySideDiffRenderer(Palette.sideBySide(config.color()), aligner, highlighter,
                    config.context(), config.terminalWidth());
            case UNIFIED -> new UnifiedDiffRenderer(Palette.unified(config.color()), aligner, highlighter,
                    config.context());
        };
    }
}
