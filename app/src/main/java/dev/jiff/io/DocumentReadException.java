package dev.jiff.io;

import java.nio.file.Path;

/**
 * Runtime exception raised when an input document cannot be read.
 */
public class DocumentReadException extends RuntimeException {

    private final Path path;

    public DocumentReadException(Path path, Throwable cause) {
        super("Could not read " + path + ": " + describe(cause), cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        String type = cause.getClass().getSimpleName();
        return message == null || message.isBlank() ? type : type + " (" + message + ")";
    }
}
