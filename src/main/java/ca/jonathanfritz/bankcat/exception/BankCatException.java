package ca.jonathanfritz.bankcat.exception;

public class BankCatException extends Exception {

    public BankCatException(String message) {
        super(message);
    }

    public BankCatException(String message, Throwable t) {
        super(message, t);
    }
}
