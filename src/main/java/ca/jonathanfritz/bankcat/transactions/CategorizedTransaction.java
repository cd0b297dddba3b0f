package ca.jonathanfritz.bankcat.transactions;

import java.util.Objects;
import java.util.Optional;

/**
 * Represents a {@link Transaction} that has been assigned a category, and optionally a payment label
 */
public class CategorizedTransaction extends Transaction {

    public static final String UNKNOWN = "Unknown";

    private final String category;
    private final String payment;

    public CategorizedTransaction(Transaction transaction, String category) {
        this(transaction, category, null);
    }

    public CategorizedTransaction(Transaction transaction, String category, String payment) {
        super(Transaction.newBuilder(transaction));
        this.category = Objects.requireNonNull(category, "category");
        this.payment = payment;
    }

    public String getCategory() {
        return category;
    }

    /**
     * The payment label, which is only assigned by rule tables that have one
     */
    public Optional<String> getPayment() {
        return Optional.ofNullable(payment);
    }

    /**
     * True if neither the category nor the payment label could be resolved from the rule table
     */
    public boolean isUnresolved() {
        return UNKNOWN.equals(category) || UNKNOWN.equals(payment);
    }

    @Override
    public String toString() {
        return "CategorizedTransaction{" +
                "transaction=" + super.toString() +
                ", category='" + category + '\'' +
                ", payment='" + payment + '\'' +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        if (!super.equals(o)) return false;
        CategorizedTransaction that = (CategorizedTransaction) o;
        return Objects.equals(category, that.category) &&
                Objects.equals(payment, that.payment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), category, payment);
    }
}
