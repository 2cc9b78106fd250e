package com.nana.equip.util;

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
 * <p>Layers three sources, later ones winning: built-in defaults, the
 * {@code equipment-import.properties} classpath resource, and an optional
 * file named by the {@code equipment.import.config} system property.
 */
public final class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    public static final String RESOURCE_NAME          = "equipment-import.properties";
    public static final String OVERRIDE_PROPERTY      = "equipment.import.config";

    public static final String KEY_DB_URL             = "db.url";
    public static final String KEY_SUPPLIER_THRESHOLD = "import.supplier.match.threshold";
    public static final String KEY_WAREHOUSE          = "import.inventory.warehouse";
    public static final String KEY_DEFAULT_FILENAME   = "import.default.filename";

    private static final Properties DEFAULTS = new Properties();

    static {
        DEFAULTS.setProperty(KEY_DB_URL,             "jdbc:sqlite:equipment_import.db");
        DEFAULTS.setProperty(KEY_SUPPLIER_THRESHOLD, "0.7");
        DEFAULTS.setProperty(KEY_WAREHOUSE,          "fl");
        DEFAULTS.setProperty(KEY_DEFAULT_FILENAME,   "equipment-upload.csv");
    }

    private static AppConfig instance;

    public static synchronized AppConfig getInstance() {
        if (instance == null) {
            instance = load();
        }
        return instance;
    }

    /**
     * Reads the classpath resource and the optional override file.
     *
     * @return a freshly loaded configuration
     */
    public static AppConfig load() {
        Properties props = new Properties(DEFAULTS);
        try (InputStream in = AppConfig.class.getClassLoader()
                .getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                props.load(in);
            } else {
                log.debug("No {} on the classpath; using defaults.", RESOURCE_NAME);
            }
        } catch (IOException ex) {
            log.warn("Failed to load {}: {}", RESOURCE_NAME, ex.getMessage());
        }

        String override = System.getProperty(OVERRIDE_PROPERTY);
        if (override != null && !override.isBlank()) {
            Path path = Paths.get(override);
            if (Files.isRegularFile(path)) {
                try (InputStream in = Files.newInputStream(path)) {
                    props.load(in);
                    log.info("Configuration override loaded from {}", path.toAbsolutePath());
                } catch (IOException ex) {
                    log.warn("Failed to load configuration override {}: {}", path, ex.getMessage());
                }
            } else {
                log.warn("Configuration override {} does not exist; ignoring.", path);
            }
        }
        return new AppConfig(props);
    }

    /**
     * Creates a configuration from explicit values layered over the defaults.
     *
     * @param values properties to apply
     * @return the configuration
     */
    public static AppConfig of(Properties values) {
        Properties props = new Properties(DEFAULTS);
        props.putAll(values);
        return new AppConfig(props);
    }

    private final Properties props;

    private AppConfig(Properties props) {
        this.props = props;
    }

    public String getString(String key) {
        return props.getProperty(key);
    }

    public int getInt(String key, int defaultValue) {
        try {
            return Integer.parseInt(props.getProperty(key).trim());
        } catch (NumberFormatException | NullPointerException ex) {
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        try {
            return Double.parseDouble(props.getProperty(key).trim());
        } catch (NumberFormatException | NullPointerException ex) {
            return defaultValue;
        }
    }

    public boolean getBoolean(String key) {
        String val = props.getProperty(key, "false").toLowerCase().trim();
        return val.equals("true") || val.equals("yes") || val.equals("1");
    }

    public void set(String key, String value) {
        props.setProperty(key, value);
    }

    public String getDatabaseUrl() {
        return getString(KEY_DB_URL);
    }

    public double getSupplierMatchThreshold() {
        return getDouble(KEY_SUPPLIER_THRESHOLD, 0.7);
    }

    public String getInventoryWarehouse() {
        return getString(KEY_WAREHOUSE);
    }

    public String getDefaultFilename() {
        return getString(KEY_DEFAULT_FILENAME);
    }
}
