package ca.jonathanfritz.bankcat.matching;

import ca.jonathanfritz.bankcat.TestUtils;
import ca.jonathanfritz.bankcat.config.RuleSchema;
import ca.jonathanfritz.bankcat.exception.RuleTableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.notNullValue;

class TransactionMapClassifierTest {

    private static final String RULES = """
            {
              "Transaction Map": {
                "Payments": {
                  "Groceries": {
                    "Woolworths": ["woolworths", "  WW FOOD  "],
                    "Checkers": ["checkers"]
                  },
                  "Eating Out": {
                    "Woolworths Cafe": ["woolworths cafe"]
                  }
                },
                "Transfer": {
                  "Savings": {
                    "Own Account": []
                  }
                },
                "EFT": {
                  "CategoryX": {
                    "LabelY": ["rent", "lease"]
                  },
                  "CategoryZ": {
                    "LabelW": ["school"]
                  }
                },
                "Fee": {
                  "Bank Charges": {
                    "Monthly Fee": ["monthly fee"]
                  }
                },
                "Debit Order": {
                  "Insurance": {
                    "Car": ["outsurance"]
                  },
                  "Medical": {
                    "Aid": ["discovery health"]
                  }
                }
              }
            }
            """;

    private final TransactionClassifier classifier = load(RULES);

    @ParameterizedTest
    @ValueSource(strings = {"Apple Pay", "POS Purchase", "FNB Generic"})
    void genericPaymentTypesUsePaymentsTest(String type) {
        final Classification classification = classifier.classify(TestUtils.createTransaction(type, "WOOLWORTHS SANDTON"));
        assertThat(classification, equalTo(new Classification("Groceries", "Woolworths")));
    }

    @Test
    void firstMatchInTableOrderWinsTest() {
        // both Woolworths and Woolworths Cafe match, but Groceries comes first in the table
        final Classification classification = classifier.classify(TestUtils.createTransaction("POS Purchase", "Woolworths Cafe Rosebank"));
        assertThat(classification, equalTo(new Classification("Groceries", "Woolworths")));
    }

    @Test
    void matchStringsAreTrimmedAndCaseInsensitiveTest() {
        final Classification classification = classifier.classify(TestUtils.createTransaction("Apple Pay", "  ww food hyde park "));
        assertThat(classification, equalTo(new Classification("Groceries", "Woolworths")));
    }

    @Test
    void genericPaymentWithoutMatchIsUnknownTest() {
        final Classification classification = classifier.classify(TestUtils.createTransaction("FNB Generic", "SALARY ACME"));
        assertThat(classification, equalTo(Classification.unknown()));
    }

    @Test
    void typeSpecificRulesTest() {
        final Classification classification = classifier.classify(TestUtils.createTransaction("Debit Order", "DISCOVERY HEALTH 1234"));
        assertThat(classification, equalTo(new Classification("Medical", "Aid")));
    }

    @Test
    void typeSpecificRulesDoNotUsePaymentsTest() {
        // a Debit Order for woolworths is not a card purchase, so the Payments rules do not apply
        final Classification classification = classifier.classify(TestUtils.createTransaction("Debit Order", "WOOLWORTHS CARD"));
        assertThat(classification, equalTo(Classification.unknown()));
    }

    @Test
    void unknownTypeTest() {
        final Classification classification = classifier.classify(TestUtils.createTransaction("Cheque Deposit", "WOOLWORTHS"));
        assertThat(classification, equalTo(Classification.unknown()));
    }

    @Test
    void missingTypeTest() {
        final Classification classification = classifier.classify(TestUtils.createTransaction(null, "WOOLWORTHS"));
        assertThat(classification, notNullValue());
        assertThat(classification, equalTo(Classification.unknown()));
    }

    @Test
    void transferShortCircuitTest() {
        final Classification classification = classifier.classify(TestUtils.createTransaction("Transfer", "anything at all"));
        assertThat(classification, equalTo(new Classification("Transfer", "Transfer")));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"Transaction Map\": {\"Transfer\": {}}}",
            "{\"Transaction Map\": {\"Transfer\": {\"Savings\": {}}}}"
    })
    void transferWithoutPaymentLabelIsUnknownTest(String json) {
        // Setup:
        final TransactionClassifier withEmptyTransfer = load(json);

        // Execute:
        final Classification classification = withEmptyTransfer.classify(TestUtils.createTransaction("Transfer", "to savings"));

        // Verify:
        assertThat(classification, equalTo(Classification.unknown()));
    }

    @Test
    void transferWithoutTableEntryIsUnknownTest() throws RuleTableException {
        final TransactionClassifier withoutTransfer = load("""
                {"Transaction Map": {"Payments": {}}}
                """);

        final Classification classification = withoutTransfer.classify(TestUtils.createTransaction("Transfer", "to savings"));
        assertThat(classification, equalTo(Classification.unknown()));
    }

    @Test
    void eftFirstMatchStringTest() {
        // the description becomes the payment label
        final Classification classification = classifier.classify(TestUtils.createTransaction("EFT", "Monthly Rent"));
        assertThat(classification, equalTo(new Classification("CategoryX", "Monthly Rent")));
    }

    @Test
    void eftOnlyChecksFirstMatchStringTest() {
        // "lease" and "school" are in the table, but only "rent" is ever checked
        assertThat(classifier.classify(TestUtils.createTransaction("EFT", "Lease payment")),
                equalTo(new Classification(TransactionMapClassifier.UNCATEGORISED, "Lease payment")));
        assertThat(classifier.classify(TestUtils.createTransaction("EFT", "School fees")),
                equalTo(new Classification(TransactionMapClassifier.UNCATEGORISED, "School fees")));
    }

    @Test
    void eftWithoutMatchStringsIsUnknownTest() throws RuleTableException {
        final TransactionClassifier emptyEft = load("""
                {"Transaction Map": {"EFT": {"CategoryX": {"LabelY": []}}}}
                """);

        final Classification classification = emptyEft.classify(TestUtils.createTransaction("EFT", "Monthly Rent"));
        assertThat(classification, equalTo(Classification.unknown()));
    }

    @Test
    void assignsPaymentTest() {
        assertThat(classifier.assignsPayment(), equalTo(true));
    }

    private static TransactionClassifier load(String json) {
        try {
            return new RuleTableLoader().loadFromString(json, RuleSchema.TRANSACTION_MAP).newClassifier();
        } catch (RuleTableException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
