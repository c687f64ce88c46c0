package dev.jiff.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the documents to compare as UTF-8 text.
 */
public class DocumentReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentReader.class);

    public String read(Path path) {
        Objects.requireNonNull(path, "path");
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            LOGGER.debug("Read {} ({} chars)", path, content.length());
            return content;
        } catch (IOException ex) {
            throw new DocumentReadException(path, ex);
        }
    }
}
