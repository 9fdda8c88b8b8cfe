package com.nana.srs.util;

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
 * <p>Lookup order for every key: JVM system property, then the optional
 * {@code student-records.properties} file in the working directory, then the
 * built-in default.
 */
public final class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    public static final String PROPERTIES_FILE_NAME = "student-records.properties";

    public static final String KEY_DB_FILE         = "db.file";
    public static final String KEY_BUSY_TIMEOUT_MS = "db.busy.timeout.ms";
    public static final String KEY_CONFIRM_DELETE  = "ui.confirm.delete";

    private static final Properties DEFAULTS = new Properties();

    static {
        DEFAULTS.setProperty(KEY_DB_FILE,         "students.db");
        DEFAULTS.setProperty(KEY_BUSY_TIMEOUT_MS, String.valueOf(DatabaseManager.DEFAULT_BUSY_TIMEOUT_MS));
        DEFAULTS.setProperty(KEY_CONFIRM_DELETE,  "true");
    }

    private static AppConfig instance;

    public static synchronized AppConfig getInstance() {
        if (instance == null) {
            instance = load(Paths.get(PROPERTIES_FILE_NAME));
        }
        return instance;
    }

    /**
     * Builds a configuration from the given properties file. A missing file
     * leaves the defaults in place.
     */
    public static AppConfig load(Path propertiesFile) {
        return new AppConfig(propertiesFile);
    }

    private final Properties props;
    private final Path propertiesFilePath;

    private AppConfig(Path propertiesFilePath) {
        this.propertiesFilePath = propertiesFilePath;
        this.props = new Properties(DEFAULTS);
        loadUserProperties();
        log.info("AppConfig loaded. Properties file: {}", propertiesFilePath.toAbsolutePath());
    }

    public String getString(String key) {
        String override = System.getProperty(key);
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        return props.getProperty(key);
    }

    public int getInt(String key, int defaultValue) {
        try {
            return Integer.parseInt(getString(key));
        } catch (NumberFormatException ex) {
            log.warn("Property '{}' is not a number; using {}.", key, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key) {
        String raw = getString(key);
        String val = raw == null ? "false" : raw.toLowerCase().trim();
        return val.equals("true") || val.equals("yes") || val.equals("1");
    }

    public void set(String key, String value) {
        props.setProperty(key, value);
    }

    // -----------------------------------------------------------------------
    // TYPED ACCESSORS
    // -----------------------------------------------------------------------

    public Path getDbFile() {
        return Paths.get(getString(KEY_DB_FILE));
    }

    public int getBusyTimeoutMs() {
        int timeout = getInt(KEY_BUSY_TIMEOUT_MS, DatabaseManager.DEFAULT_BUSY_TIMEOUT_MS);
        return timeout < 0 ? DatabaseManager.DEFAULT_BUSY_TIMEOUT_MS : timeout;
    }

    public boolean isConfirmDelete() {
        return getBoolean(KEY_CONFIRM_DELETE);
    }

    private void loadUserProperties() {
        if (!Files.exists(propertiesFilePath)) {
            log.debug("Properties file not found; using defaults.");
            return;
        }
        try (InputStream in = Files.newInputStream(propertiesFilePath)) {
            props.load(in);
        } catch (IOException ex) {
            log.warn("Failed to load properties from {}: {}", propertiesFilePath, ex.getMessage());
        }
    }
}
