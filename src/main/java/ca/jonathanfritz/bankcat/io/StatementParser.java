package ca.jonathanfritz.bankcat.io;

import ca.jonathanfritz.bankcat.exception.MalformedSourceException;
import ca.jonathanfritz.bankcat.transactions.Transaction;

import java.nio.file.Path;
import java.util.List;

/**
 * Every bank exports statements in its own flavour of CSV. A {@link StatementParser} reads one file in a known
 * {@link SourceDialect} and converts each of its rows into a canonical {@link Transaction}. Use
 * {@link StatementParserFactory#findByDialect(SourceDialect)} to find the implementation for a source folder.
 *
 * Implementations hold no state between files, so files may be parsed in any order.
 *
 * @see StatementParserFactory
 */
public interface StatementParser {

    /**
     * Returns the statement layout that this parser understands
     */
    SourceDialect getDialect();

    /**
     * Parses every data row of the specified file
     *
     * @throws MalformedSourceException if the file cannot be read or does not have the structure of its dialect
     */
    List<Transaction> parse(Path file) throws MalformedSourceException;
}
