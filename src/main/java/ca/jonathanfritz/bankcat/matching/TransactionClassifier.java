package ca.jonathanfritz.bankcat.matching;

import ca.jonathanfritz.bankcat.transactions.Transaction;

/**
 * Assigns a category, and possibly a payment label, to a transaction. Implementations never return null: a transaction
 * that no rule matches is classified as {@link Classification#UNKNOWN}.
 */
public interface TransactionClassifier {

    Classification classify(Transaction transaction);

    /**
     * True if {@link #classify(Transaction)} assigns a payment label as well as a category
     */
    boolean assignsPayment();
}
