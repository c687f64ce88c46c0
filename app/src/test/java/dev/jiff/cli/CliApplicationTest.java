package dev.jiff.cli;

import static org.assertj.core.api.Assertions.assertThat;

import dev.jiff.config.ConfigLoader;
import dev.jiff.config.TerminalSizeProvider;
import dev.jiff.io.DocumentReader;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void printsUnifiedDiffAndSucceeds() throws Exception {
        Path left = write("left.txt", "a\nbar\nc\n");
        Path right = write("right.txt", "a\nbaz\nc\n");

        int exitCode = application(Map.of()).run(new String[] {"--no-color", left.toString(), right.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(out.toString().lines()).containsExactly("  a", "- bar", "+ baz", "  c");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void noColorEnvironmentDisablesEscapes() throws Exception {
        Path left = write("left.txt", "bar\n");
        Path right = write("right.txt", "baz\n");

        int exitCode = application(Map.of("NO_COLOR", "1")).run(new String[] {left.toString(), right.toString()});

        assertThat(exitCode).isZero();
        assertThat(out.toString()).doesNotContain("\u001b[");
    }

    @Test
    void colorsOutputByDefault() throws Exception {
        Path left = write("left.txt", "bar\n");
        Path right = write("right.txt", "baz\n");

        application(Map.of()).run(new String[] {left.toString(), right.toString()});

        assertThat(out.toString()).contains("\u001b[30;41mr\u001b[0m", "\u001b[30;42mz\u001b[0m");
    }

    @Test
    void printsSideBySideLayout() throws Exception {
        Path left = write("left.txt", "x\nalpha\nbeta\ny\n");
        Path right = write("right.txt", "x\nbeta!\ny\n");

        int exitCode = application(Map.of()).run(new String[] {
                "-s", "--no-color", "--width", "41", left.toString(), right.toString()});

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly(
                "1: x" + " ".repeat(16) + "│1: x",
                "2: alpha" + " ".repeat(12) + "│   ",
                "3: beta" + " ".repeat(13) + "│2: beta!",
                "4: y" + " ".repeat(16) + "│3: y");
    }

    @Test
    void gitModePrintsHeaderWithRepositoryPaths() throws Exception {
        Path oldFile = write("old", "one\n");
        Path newFile = write("new", "two\n");

        int exitCode = application(Map.of()).run(new String[] {
                "--git-diff", "--no-color",
                "src/file.txt", oldFile.toString(), "1111111", "100644", newFile.toString(), "2222222", "100644"});

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines())
                .containsExactly("--- a/src/file.txt", "+++ b/src/file.txt", "- one", "+ two");
    }

    @Test
    void largestContextPrintsEveryUnchangedLine() throws Exception {
        Path left = write("left.txt", "a\nb\nc\n");
        Path right = write("right.txt", "a\nb\nd\n");

        int exitCode = application(Map.of()).run(new String[] {
                "--no-color", "--context", "2147483647", left.toString(), right.toString()});

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("  a", "  b", "- c", "+ d");
    }

    @Test
    void missingFileExitsWithReadFailure() throws Exception {
        Path left = write("left.txt", "a\n");
        Path missing = tempDir.resolve("missing.txt");

        int exitCode = application(Map.of()).run(new String[] {left.toString(), missing.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_READ_FAILURE);
        assertThat(err.toString()).startsWith("Could not read " + missing);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void singleFileIsInvalidInput() {
        int exitCode = application(Map.of()).run(new String[] {"only.txt"});

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Usage: jiff");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void invalidEnvironmentIsInvalidInput() throws Exception {
        Path left = write("left.txt", "a\n");
        Path right = write("right.txt", "b\n");

        int exitCode = application(Map.of("COLUMNS", "wide")).run(new String[] {left.toString(), right.toString()});

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).startsWith("COLUMNS must be an integer").contains("Usage: jiff");
    }

    @Test
    void unknownLogFormatIsInvalidInput() {
        int exitCode = application(Map.of()).run(new String[] {"--log-format", "xml", "a", "b"});

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Unsupported log format: xml");
    }

    @Test
    void helpAndVersionExitCleanly() {
        assertThat(application(Map.of()).run(new String[] {"--help"})).isZero();
        assertThat(out.toString()).contains("Usage: jiff", "--side-by-side", "--git-diff");

        assertThat(application(Map.of()).run(new String[] {"--version"})).isZero();
        assertThat(out.toString()).contains("jiff 0.1.0");
    }

    @Test
    void identicalFilesPrintEveryLine() throws Exception {
        Path left = write("left.txt", "same\nlines\n");
        Path right = write("right.txt", "same\nlines\n");

        int exitCode = application(Map.of()).run(new String[] {left.toString(), right.toString()});

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("  same", "  lines");
    }

    private CliApplication application(Map<String, String> environment) {
        return new CliApplication(new ConfigLoader(key -> Optional.ofNullable(environment.get(key)), TerminalSizeProvider.NONE),
                new DocumentReader(), new PrintWriter(out, true), new PrintWriter(err, true));
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
