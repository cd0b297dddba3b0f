package ca.jonathanfritz.bankcat.io;

/**
 * The statement layouts that bankcat can read, one per source folder.
 * Declaration order is the order in which sources are merged.
 */
public enum SourceDialect {

    /**
     * FNB exports: four metadata lines that name the account, then a header row and data
     */
    FNB,

    /**
     * Discovery credit card exports: a single header row with Discovery's own column names
     */
    DISCOVERY,

    /**
     * Standard Bank exports: three prefix lines, positional columns with no header, and a trailer line
     */
    STANDARD_BANK,

    /**
     * A hand-kept cash ledger with Date, Description and Amount columns
     */
    CASH
}
