package ca.jonathanfritz.bankcat.cli;

import org.beryx.textio.TextIO;

import java.util.List;

/**
 * Console output for reports and help text
 */
public class CLI {

    private final TextIO textIO;

    public CLI(TextIO textIO) {
        this.textIO = textIO;
    }

    /**
     * Prints the specified line to the terminal, along with a trailing newline character
     */
    public void println(String line) {
        textIO.getTextTerminal().println(line);
    }

    /**
     * Prints the specified lines to the terminal, advancing to the next line after each
     */
    public void println(List<String> lines) {
        textIO.getTextTerminal().println(lines);
    }
}
