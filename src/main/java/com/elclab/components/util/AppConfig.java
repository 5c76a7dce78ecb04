package com.elclab.components.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * AppConfig - Application Configuration Manager
 *
 * <p>Read-only view of {@code catalog.properties} overlaid on built-in
 * defaults. Edit the file to change a setting.
 */
public final class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    public static final String APP_DIR_NAME              = "ComponentCatalog";

    public static final String KEY_DATABASE_PATH         = "database.path";
    public static final String KEY_AUTO_CATEGORIZE       = "import.auto.categorize";
    public static final String KEY_WRITE_IMPORT_REPORT   = "import.write.report";
    public static final String KEY_SEED_CATEGORIES       = "startup.seed.categories";
    public static final String KEY_LOG_LEVEL             = "logging.level";

    private static final Properties DEFAULTS = new Properties();

    static {
        Path appDir = defaultAppDirectory();
        DEFAULTS.setProperty(KEY_DATABASE_PATH,       appDir.resolve("components.db").toString());
        DEFAULTS.setProperty(KEY_AUTO_CATEGORIZE,     "false");
        DEFAULTS.setProperty(KEY_WRITE_IMPORT_REPORT, "true");
        DEFAULTS.setProperty(KEY_SEED_CATEGORIES,     "true");
        DEFAULTS.setProperty(KEY_LOG_LEVEL,           "INFO");
    }

    private static AppConfig instance;

    public static synchronized AppConfig getInstance() {
        if (instance == null) {
            instance = new AppConfig(defaultAppDirectory().resolve("catalog.properties"));
        }
        return instance;
    }

    private final Properties props;
    private final Path propertiesFilePath;

    /**
     * Loads defaults overlaid with the user properties at the given path.
     * A missing file means "all defaults".
     *
     * @param propertiesFilePath user properties file
     */
    public AppConfig(Path propertiesFilePath) {
        this.propertiesFilePath = propertiesFilePath;
        this.props = new Properties(DEFAULTS);
        loadUserProperties();
        log.info("AppConfig loaded. Properties file: {}", propertiesFilePath.toAbsolutePath());
    }

    public String getString(String key) {
        return props.getProperty(key);
    }

    public boolean getBoolean(String key) {
        String val = props.getProperty(key, "false").toLowerCase().trim();
        return val.equals("true") || val.equals("yes") || val.equals("1");
    }

    public Path getDatabasePath() {
        return Paths.get(getString(KEY_DATABASE_PATH));
    }

    public boolean isAutoCategorize() {
        return getBoolean(KEY_AUTO_CATEGORIZE);
    }

    public boolean isWriteImportReport() {
        return getBoolean(KEY_WRITE_IMPORT_REPORT);
    }

    public boolean isSeedCategories() {
        return getBoolean(KEY_SEED_CATEGORIES);
    }

    private void loadUserProperties() {
        if (!Files.exists(propertiesFilePath)) {
            log.debug("User properties file not found; using defaults.");
            return;
        }
        try (InputStream in = Files.newInputStream(propertiesFilePath)) {
            props.load(in);
        } catch (IOException ex) {
            log.warn("Failed to load user properties: {}", ex.getMessage());
        }
    }

    static Path defaultAppDirectory() {
        return Paths.get(System.getProperty("user.home"), APP_DIR_NAME);
    }
}
