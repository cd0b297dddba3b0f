package ca.jonathanfritz.bankcat.config;

/**
 * Application configuration loaded from ~/.bankcat/config.yaml.
 * Contains all user-configurable settings.
 */
public class AppConfig {

    private RuleSchema ruleSchema;
    private String rulesPath;
    private String inputDirectory;
    private String outputDirectory;
    private String fileExtension;
    private String transactionsFile;
    private String budgetFile;
    private Sources sources;

    public AppConfig() {
        // Default values
        this.ruleSchema = RuleSchema.TRANSACTION_MAP;
        this.rulesPath = "mappings.json";
        this.inputDirectory = "input";
        this.outputDirectory = ".";
        this.fileExtension = ".csv";
        this.transactionsFile = "Transactions.csv";
        this.budgetFile = "Budget.csv";
        this.sources = new Sources();
    }

    /**
     * Creates a default configuration with sensible defaults.
     */
    public static AppConfig defaults() {
        return new AppConfig();
    }

    public RuleSchema getRuleSchema() {
        return ruleSchema;
    }

    public void setRuleSchema(RuleSchema ruleSchema) {
        this.ruleSchema = ruleSchema != null ? ruleSchema : RuleSchema.TRANSACTION_MAP;
    }

    /**
     * Path to the rule table. Relative paths are resolved against the input directory.
     */
    public String getRulesPath() {
        return rulesPath;
    }

    public void setRulesPath(String rulesPath) {
        this.rulesPath = rulesPath;
    }

    public String getInputDirectory() {
        return inputDirectory;
    }

    public void setInputDirectory(String inputDirectory) {
        this.inputDirectory = inputDirectory;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    public void setOutputDirectory(String outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    public void setFileExtension(String fileExtension) {
        this.fileExtension = fileExtension;
    }

    public String getTransactionsFile() {
        return transactionsFile;
    }

    public void setTransactionsFile(String transactionsFile) {
        this.transactionsFile = transactionsFile;
    }

    public String getBudgetFile() {
        return budgetFile;
    }

    public void setBudgetFile(String budgetFile) {
        this.budgetFile = budgetFile;
    }

    public Sources getSources() {
        return sources;
    }

    public void setSources(Sources sources) {
        this.sources = sources != null ? sources : new Sources();
    }

    /**
     * Folder names and account identities of the four supported statement sources
     */
    public static class Sources {
        private SourceSettings fnb;
        private SourceSettings discovery;
        private SourceSettings standardBank;
        private SourceSettings cash;

        public Sources() {
            // FNB statements carry their own account details in a metadata row
            this.fnb = new SourceSettings("FNB", null, null);
            this.discovery = new SourceSettings("Discovery", "17275813806", "Discovery Credit Card");
            this.standardBank = new SourceSettings("Standard Bank", "428094465", "Standard Bank");
            this.cash = new SourceSettings("Cash", "Cash Account", "Cash Transactions");
        }

        public SourceSettings getFnb() {
            return fnb;
        }

        public void setFnb(SourceSettings fnb) {
            this.fnb = fnb;
        }

        public SourceSettings getDiscovery() {
            return discovery;
        }

        public void setDiscovery(SourceSettings discovery) {
            this.discovery = discovery;
        }

        public SourceSettings getStandardBank() {
            return standardBank;
        }

        public void setStandardBank(SourceSettings standardBank) {
            this.standardBank = standardBank;
        }

        public SourceSettings getCash() {
            return cash;
        }

        public void setCash(SourceSettings cash) {
            this.cash = cash;
        }
    }

    /**
     * Settings for one statement source
     */
    public static class SourceSettings {
        private String folder;
        private String accountNumber;
        private String accountName;

        public SourceSettings() {
        }

        public SourceSettings(String folder, String accountNumber, String accountName) {
            this.folder = folder;
            this.accountNumber = accountNumber;
            this.accountName = accountName;
        }

        public String getFolder() {
            return folder;
        }

        public void setFolder(String folder) {
            this.folder = folder;
        }

        public String getAccountNumber() {
            return accountNumber;
        }

        public void setAccountNumber(String accountNumber) {
            this.accountNumber = accountNumber;
        }

        public String getAccountName() {
            return accountName;
        }

        public void setAccountName(String accountName) {
            this.accountName = accountName;
        }
    }
}
