package ca.jonathanfritz.bankcat.transactions;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single transaction in the canonical shape that every statement dialect is normalized into.
 * Two transactions are equal only if every field matches, which is what de-duplication relies on.
 */
public class Transaction {

    /**
     * Rendered in place of the date when the source value could not be parsed
     */
    public static final String UNPARSEABLE_DATE = "Invalid Date";

    public static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    private final LocalDate date;
    private final String rawDate;
    private final String description;
    private final BigDecimal amount;
    private final String type;
    private final Account account;
    private final Map<String, String> extraColumns;

    protected Transaction(Builder builder) {
        date = builder.date;
        rawDate = builder.rawDate;
        description = Objects.requireNonNull(builder.description, "description");
        amount = Objects.requireNonNull(builder.amount, "amount");
        type = builder.type;
        account = builder.account;
        extraColumns = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extraColumns));
    }

    /**
     * Returns the date of the transaction, or null if the source value could not be parsed
     */
    public LocalDate getDate() {
        return date;
    }

    /**
     * Returns the date exactly as it appeared in the source file
     */
    public String getRawDate() {
        return rawDate;
    }

    /**
     * Returns the date in yyyy/MM/dd form, or {@link #UNPARSEABLE_DATE}
     */
    public String getFormattedDate() {
        return date != null ? date.format(DATE_FORMATTER) : UNPARSEABLE_DATE;
    }

    public String getDescription() {
        return description;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public String getType() {
        return type;
    }

    public Account getAccount() {
        return account;
    }

    /**
     * Source columns that have no canonical counterpart, in the order they appeared in the file
     */
    public Map<String, String> getExtraColumns() {
        return extraColumns;
    }

    // a parsed date is compared by value so that differently formatted copies of the same row collapse
    private Object dateKey() {
        return date != null ? date : rawDate;
    }

    @Override
    public String toString() {
        return "Transaction{" +
                "date=" + getFormattedDate() +
                ", description='" + description + '\'' +
                ", amount=" + amount +
                ", type='" + type + '\'' +
                ", account=" + account +
                ", extraColumns=" + extraColumns +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Transaction that = (Transaction) o;
        return amount.compareTo(that.amount) == 0 &&
                Objects.equals(dateKey(), that.dateKey()) &&
                Objects.equals(description, that.description) &&
                Objects.equals(type, that.type) &&
                Objects.equals(account, that.account) &&
                Objects.equals(extraColumns, that.extraColumns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dateKey(), description, amount.stripTrailingZeros(), type, account, extraColumns);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static Builder newBuilder(Transaction copy) {
        Builder builder = new Builder();
        builder.date = copy.getDate();
        builder.rawDate = copy.getRawDate();
        builder.description = copy.getDescription();
        builder.amount = copy.getAmount();
        builder.type = copy.getType();
        builder.account = copy.getAccount() != null ? Account.newBuilder(copy.getAccount()).build() : null;
        builder.extraColumns.putAll(copy.getExtraColumns());
        return builder;
    }

    public static final class Builder {

        private LocalDate date;
        private String rawDate;
        private String description;
        private BigDecimal amount;
        private String type;
        private Account account;
        private final Map<String, String> extraColumns = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder setDate(LocalDate date) {
            this.date = date;
            return this;
        }

        public Builder setRawDate(String rawDate) {
            this.rawDate = rawDate;
            return this;
        }

        public Builder setDescription(String description) {
            this.description = description;
            return this;
        }

        public Builder setAmount(BigDecimal amount) {
            this.amount = amount;
            return this;
        }

        public Builder setType(String type) {
            this.type = type;
            return this;
        }

        public Builder setAccount(Account account) {
            this.account = account;
            return this;
        }

        public Builder putExtraColumn(String name, String value) {
            this.extraColumns.put(name, value);
            return this;
        }

        public Transaction build() {
            return new Transaction(this);
        }
    }
}
