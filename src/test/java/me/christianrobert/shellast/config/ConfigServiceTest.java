package me.christianrobert.shellast.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
    }

    @Test
    void defaults() {
        assertEquals(10 * 1024 * 1024, configService.getConfigValueAsInteger(ConfigService.MAX_SCRIPT_SIZE));
        assertEquals(256, configService.getConfigValueAsInteger(ConfigService.MAX_DEPTH));
        assertEquals(100_000, configService.getConfigValueAsInteger(ConfigService.MAX_LIST_LENGTH));
    }

    @Test
    void stringValuesAreParsed() {
        configService.setConfigValue(ConfigService.MAX_DEPTH, " 64 ");

        assertEquals(64, configService.getPositiveInteger(ConfigService.MAX_DEPTH, 256));
    }

    @Test
    void unusableValuesFallBackToDefault() {
        configService.setConfigValue(ConfigService.MAX_DEPTH, "deep");
        configService.setConfigValue(ConfigService.MAX_LIST_LENGTH, -5);

        assertNull(configService.getConfigValueAsInteger(ConfigService.MAX_DEPTH));
        assertEquals(256, configService.getPositiveInteger(ConfigService.MAX_DEPTH, 256));
        assertEquals(1000, configService.getPositiveInteger(ConfigService.MAX_LIST_LENGTH, 1000));
        assertEquals(7, configService.getPositiveInteger("missing.key", 7));
    }

    @Test
    void nullValueRemovesKey() {
        configService.setConfigValue(ConfigService.MAX_DEPTH, 32);
        assertEquals(32, configService.getPositiveInteger(ConfigService.MAX_DEPTH, 256));

        configService.setConfigValue(ConfigService.MAX_DEPTH, null);

        assertNull(configService.getConfigValueAsInteger(ConfigService.MAX_DEPTH));
        assertEquals(256, configService.getPositiveInteger(ConfigService.MAX_DEPTH, 256));
    }
}
