package com.nana.equip.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    @DisplayName("The bundled properties supply every import setting")
    void bundledDefaults() {
        AppConfig config = AppConfig.load();
        assertTrue(config.getDatabaseUrl().startsWith("jdbc:sqlite:"));
        assertEquals(0.7, config.getSupplierMatchThreshold(), 0.0001);
        assertEquals("equipment-upload.csv", config.getDefaultFilename());
        assertNotNull(config.getInventoryWarehouse());
    }

    @Test
    @DisplayName("Explicit values override defaults; malformed numbers fall back")
    void explicitValues() {
        Properties values = new Properties();
        values.setProperty(AppConfig.KEY_WAREHOUSE, "north");
        values.setProperty(AppConfig.KEY_SUPPLIER_THRESHOLD, "high");

        AppConfig config = AppConfig.of(values);

        assertEquals("north", config.getInventoryWarehouse());
        assertEquals(0.7, config.getSupplierMatchThreshold(), 0.0001);
    }
}
