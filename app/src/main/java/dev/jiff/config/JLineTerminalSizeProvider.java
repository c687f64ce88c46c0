package dev.jiff.config;

import java.io.IOException;
import java.util.OptionalInt;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the system terminal for its size through JLine. Without a terminal (output piped, CI) JLine
 * falls back to a dumb terminal of width 0, which is reported as empty.
 */
public class JLineTerminalSizeProvider implements TerminalSizeProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(JLineTerminalSizeProvider.class);

    @Override
    public OptionalInt width() {
        try (Terminal terminal = TerminalBuilder.builder()
                .system(true)
                .dumb(true)
                .nativeSignals(false)
                .build()) {
            int width = terminal.getWidth();
            LOGGER.debug("Terminal {} reports width {}", terminal.getType(), width);
            return width > 0 ? OptionalInt.of(width) : OptionalInt.empty();
        } catch (IOException ex) {
            LOGGER.debug("Could not query terminal size: {}", ex.getMessage());
            return OptionalInt.empty();
        }
    }
}
