package ca.jonathanfritz.bankcat.exception;

import java.nio.file.Path;

/**
 * Thrown when a statement file violates the structural assumptions of its dialect, e.g. it has too few lines, a date
 * in the wrong format, or an account metadata row that cannot be read
 */
public class MalformedSourceException extends BankCatException {

    private final Path path;

    public MalformedSourceException(Path path, String message) {
        super(String.format("%s: %s", path, message));
        this.path = path;
    }

    public MalformedSourceException(Path path, String message, Throwable t) {
        super(String.format("%s: %s", path, message), t);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
