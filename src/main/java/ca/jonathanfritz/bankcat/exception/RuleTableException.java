package ca.jonathanfritz.bankcat.exception;

/**
 * Thrown when the rule table is missing or cannot be parsed. Nothing can be categorized without it, so this is fatal.
 */
public class RuleTableException extends BankCatException {

    public RuleTableException(String message) {
        super(message);
    }

    public RuleTableException(String message, Throwable t) {
        super(message, t);
    }
}
