package ca.jonathanfritz.bankcat.service;

import ca.jonathanfritz.bankcat.matching.Classification;
import ca.jonathanfritz.bankcat.matching.TransactionClassifier;
import ca.jonathanfritz.bankcat.transactions.CategorizedTransaction;
import ca.jonathanfritz.bankcat.transactions.Transaction;
import com.google.inject.Inject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Assigns a category to every transaction using the configured rule table. Transactions that no rule matches are kept
 * and categorized as Unknown, so that gaps in the rule table stay visible.
 */
public class TransactionCategoryService {

    private static final Logger logger = LogManager.getLogger(TransactionCategoryService.class);

    private final TransactionClassifier transactionClassifier;

    @Inject
    public TransactionCategoryService(TransactionClassifier transactionClassifier) {
        this.transactionClassifier = transactionClassifier;
    }

    /**
     * @return one categorized transaction per input transaction, in the same order
     */
    public List<CategorizedTransaction> categorize(List<Transaction> transactions) {
        final List<CategorizedTransaction> categorized = transactions.stream()
                .map(this::categorize)
                .toList();

        final long unresolved = categorized.stream().filter(CategorizedTransaction::isUnresolved).count();
        logger.info("Categorized {} transactions, {} could not be resolved", categorized.size(), unresolved);
        return categorized;
    }

    public CategorizedTransaction categorize(Transaction transaction) {
        final Classification classification = transactionClassifier.classify(transaction);
        logger.debug("Categorized {} as {}", transaction.getDescription(), classification);
        return new CategorizedTransaction(transaction, classification.category(), classification.payment());
    }

    /**
     * True if categorized transactions carry a payment label
     */
    public boolean assignsPayment() {
        return transactionClassifier.assignsPayment();
    }
}
