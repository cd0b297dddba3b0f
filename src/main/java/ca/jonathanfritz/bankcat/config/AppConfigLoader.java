package ca.jonathanfritz.bankcat.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Loads application configuration from YAML files.
 * Handles auto-creation of config with defaults when file doesn't exist.
 */
public class AppConfigLoader {

    private static final Logger logger = LogManager.getLogger(AppConfigLoader.class);
    static final String CONFIG_FILE_NAME = "config.yaml";

    private final ObjectMapper yamlMapper;

    public AppConfigLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Result of loading configuration, includes whether the file was newly created.
     */
    public record LoadResult(AppConfig config, Path configPath, boolean wasCreated) {}

    /**
     * Loads configuration from the specified directory.
     * If config.yaml doesn't exist, creates it with default values.
     *
     * @param configDirectory the directory to load config from (typically ~/.bankcat/)
     * @return the load result containing the config and whether it was newly created
     */
    public LoadResult loadOrCreate(Path configDirectory) {
        final Path configPath = configDirectory.resolve(CONFIG_FILE_NAME);

        if (Files.exists(configPath)) {
            return loadExisting(configPath);
        } else {
            return createDefault(configDirectory, configPath);
        }
    }

    private LoadResult loadExisting(Path configPath) {
        try {
            if (Files.size(configPath) == 0) {
                logger.debug("Config file is empty, using defaults: {}", configPath);
                return new LoadResult(AppConfig.defaults(), configPath, false);
            }

            AppConfig config = yamlMapper.readValue(configPath.toFile(), AppConfig.class);
            if (config == null) {
                config = AppConfig.defaults();
            }
            logger.info("Loaded configuration from {}", configPath);
            return new LoadResult(config, configPath, false);
        } catch (IOException e) {
            logger.error("Failed to load config from {}: {}. Using defaults.", configPath, e.getMessage());
            return new LoadResult(AppConfig.defaults(), configPath, false);
        }
    }

    private LoadResult createDefault(Path configDirectory, Path configPath) {
        final AppConfig config = AppConfig.defaults();

        try {
            if (!Files.exists(configDirectory)) {
                Files.createDirectories(configDirectory);
                logger.debug("Created config directory: {}", configDirectory);
            }

            Files.writeString(configPath, generateConfigWithComments(config));
            logger.info("Created default configuration at {}", configPath);

            return new LoadResult(config, configPath, true);
        } catch (IOException e) {
            logger.error("Failed to create config file at {}: {}. Using defaults.", configPath, e.getMessage());
            return new LoadResult(config, configPath, false);
        }
    }

    /**
     * Generates YAML configuration content with helpful comments.
     */
    private String generateConfigWithComments(AppConfig config) {
        final AppConfig.Sources sources = config.getSources();
        return "# bankcat configuration\n"
                + "# Edit this file to customize application behavior.\n"
                + "\n"
                + "# Rule table layout, either transaction_map or category_mapping\n"
                + "rule_schema: " + config.getRuleSchema().toConfigValue() + "\n"
                + "\n"
                + "# Path to the rule table (relative to the input directory, or absolute)\n"
                + "rules_path: " + config.getRulesPath() + "\n"
                + "\n"
                + "# Directory that contains one folder per statement source\n"
                + "input_directory: " + config.getInputDirectory() + "\n"
                + "\n"
                + "# Directory that categorized transactions are written to\n"
                + "output_directory: " + config.getOutputDirectory() + "\n"
                + "transactions_file: " + config.getTransactionsFile() + "\n"
                + "budget_file: " + config.getBudgetFile() + "\n"
                + "\n"
                + "# Only files with this extension are read from the source folders\n"
                + "file_extension: \"" + config.getFileExtension() + "\"\n"
                + "\n"
                + "# Source folders and the account details that are stamped on their transactions\n"
                + "# FNB statements name their own account, so only the folder is configurable\n"
                + "sources:\n"
                + "  fnb:\n"
                + "    folder: " + sources.getFnb().getFolder() + "\n"
                + sourceWithAccount("discovery", sources.getDiscovery())
                + sourceWithAccount("standard_bank", sources.getStandardBank())
                + sourceWithAccount("cash", sources.getCash());
    }

    private String sourceWithAccount(String key, AppConfig.SourceSettings settings) {
        return "  " + key + ":\n"
                + "    folder: \"" + settings.getFolder() + "\"\n"
                + "    account_number: \"" + settings.getAccountNumber() + "\"\n"
                + "    account_name: \"" + settings.getAccountName() + "\"\n";
    }
}
