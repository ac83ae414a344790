package de.mirkosertic.mcp.papersearch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration for the paper search server and the index builder.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. System properties
 * 2. Environment variables
 * 3. User config file (~/.mcppapers/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_INDEX_PATH = "PAPERS_INDEX_PATH";
    private static final String ENV_CORPUS_PATH = "PAPERS_CORPUS_PATH";
    private static final String PROP_INDEX_PATH = "papers.index.path";
    private static final String PROP_CORPUS_PATH = "papers.corpus.path";
    private static final String PROP_PROFILES_ACTIVE = "spring.profiles.active";
    private static final String CONFIG_DIR = ".mcppapers";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    public static final String DEPLOYED_PROFILE = "deployed";

    private String indexPath;
    private String corpusPath;
    private int defaultPageSize = 20;
    private int maxPageSize = 100;

    private boolean deployedMode = false;

    ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        config.loadFromClasspath();
        config.loadFromUserConfig();
        config.applyEnvironmentOverrides();
        config.validate();
        config.deployedMode = DEPLOYED_PROFILE.equalsIgnoreCase(activeProfile());

        logger.info("Configuration loaded: indexPath={}, corpusPath={}, pageSize={}/{}, deployedMode={}",
                config.indexPath, config.corpusPath, config.defaultPageSize, config.maxPageSize, config.deployedMode);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                applyYaml(is);
                logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                applyYaml(is);
                logger.debug("Loaded user config from: {}", userConfigPath);
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    void applyYaml(final InputStream is) {
        final Yaml yaml = new Yaml();
        final Map<String, Object> config = yaml.load(is);
        if (config != null) {
            applyYamlConfig(config);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> papersConfig = (Map<String, Object>) config.get("papers");
        if (papersConfig == null) {
            return;
        }

        final Map<String, Object> indexConfig = (Map<String, Object>) papersConfig.get("index");
        if (indexConfig != null && indexConfig.get("path") != null) {
            this.indexPath = resolveVariables(indexConfig.get("path").toString());
        }

        final Map<String, Object> corpusConfig = (Map<String, Object>) papersConfig.get("corpus");
        if (corpusConfig != null && corpusConfig.get("path") != null) {
            this.corpusPath = resolveVariables(corpusConfig.get("path").toString());
        }

        final Map<String, Object> searchConfig = (Map<String, Object>) papersConfig.get("search");
        if (searchConfig != null) {
            if (searchConfig.containsKey("default-page-size")) {
                this.defaultPageSize = ((Number) searchConfig.get("default-page-size")).intValue();
            }
            if (searchConfig.containsKey("max-page-size")) {
                this.maxPageSize = ((Number) searchConfig.get("max-page-size")).intValue();
            }
        }
    }

    private void applyEnvironmentOverrides() {
        final String envIndexPath = System.getenv(ENV_INDEX_PATH);
        if (envIndexPath != null && !envIndexPath.trim().isEmpty()) {
            this.indexPath = envIndexPath.trim();
            logger.info("Index path from environment: {}", this.indexPath);
        }

        final String envCorpusPath = System.getenv(ENV_CORPUS_PATH);
        if (envCorpusPath != null && !envCorpusPath.trim().isEmpty()) {
            this.corpusPath = envCorpusPath.trim();
            logger.info("Corpus path from environment: {}", this.corpusPath);
        }

        final String propIndexPath = System.getProperty(PROP_INDEX_PATH);
        if (propIndexPath != null && !propIndexPath.isEmpty()) {
            this.indexPath = propIndexPath;
        }
        final String propCorpusPath = System.getProperty(PROP_CORPUS_PATH);
        if (propCorpusPath != null && !propCorpusPath.isEmpty()) {
            this.corpusPath = propCorpusPath;
        }
    }

    void validate() {
        if (this.indexPath == null || this.indexPath.isEmpty()) {
            this.indexPath = getConfigDirectory().resolve("index").toString();
        }

        if (this.defaultPageSize < 1) {
            logger.warn("Invalid default page size {}, using 20", this.defaultPageSize);
            this.defaultPageSize = 20;
        }
        if (this.maxPageSize < this.defaultPageSize) {
            logger.warn("Max page size {} is below default page size {}, raising it", this.maxPageSize, this.defaultPageSize);
            this.maxPageSize = this.defaultPageSize;
        }
    }

    /**
     * Active profile from the {@code spring.profiles.active} or {@code profile} system property.
     */
    public static String activeProfile() {
        return System.getProperty(PROP_PROFILES_ACTIVE, System.getProperty("profile", "default"));
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return getConfigDirectory().resolve(USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    public String getIndexPath() {
        return indexPath;
    }

    public String getCorpusPath() {
        return corpusPath;
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
