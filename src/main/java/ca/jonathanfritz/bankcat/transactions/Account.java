package ca.jonathanfritz.bankcat.transactions;

import java.util.Objects;

/**
 * The account that a transaction was exported from
 */
public class Account {

    private final String accountNumber;
    private final String name;

    private Account(Builder builder) {
        accountNumber = builder.accountNumber;
        name = builder.name;
    }

    public String getAccountNumber() {
        return accountNumber;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Account account = (Account) o;
        return Objects.equals(accountNumber, account.accountNumber) &&
                Objects.equals(name, account.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accountNumber, name);
    }

    @Override
    public String toString() {
        return "Account{" +
                "accountNumber='" + accountNumber + '\'' +
                ", name='" + name + '\'' +
                '}';
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static Builder newBuilder(Account copy) {
        Builder builder = new Builder();
        builder.accountNumber = copy.getAccountNumber();
        builder.name = copy.getName();
        return builder;
    }

    public static final class Builder {
        private String accountNumber;
        private String name;

        private Builder() {
        }

        public Builder setAccountNumber(String accountNumber) {
            this.accountNumber = accountNumber;
            return this;
        }

        public Builder setName(String name) {
            this.name = name;
            return this;
        }

        public Account build() {
            return new Account(this);
        }
    }
}
