package ca.jonathanfritz.bankcat.exception;

/**
 * Thrown when the command line can not be understood. The help text is printed before it propagates.
 */
public class CliException extends BankCatException {

    public CliException(String message) {
        super(message);
    }

    public CliException(String message, Throwable cause) {
        super(message, cause);
    }
}
