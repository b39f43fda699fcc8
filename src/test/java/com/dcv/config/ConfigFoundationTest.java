package com.dcv.config;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigFoundationTest {

    @Test
    void nestedProperty() {
        Map<String, Object> inner = new HashMap<>();
        inner.put("permits", 20.0);
        Map<String, Object> map = new HashMap<>();
        map.put("rateGate", inner);

        ConfigFoundation config = new ConfigFoundation(map);

        assertTrue(config.hasProperty("rateGate.permits"));
        assertEquals(20L, config.getLongProperty("rateGate.permits"));
        assertFalse(config.hasProperty("rateGate.threshold"));
        assertNull(config.getProperty("rateGate.permits.value"));
    }

    @Test
    void typedGetters() {
        Map<String, Object> map = new HashMap<>();
        map.put("string", "value");
        map.put("number", "42");
        map.put("flag", "true");
        map.put("list", List.of("a", "b"));

        ConfigFoundation config = new ConfigFoundation(map);

        assertEquals("value", config.getStringProperty("string"));
        assertEquals("fallback", config.getStringProperty("missing", "fallback"));
        assertEquals(42L, config.getLongProperty("number"));
        assertEquals(7L, config.getLongProperty("missing", 7L));
        assertTrue(config.getBooleanProperty("flag"));
        assertTrue(config.getBooleanProperty("missing", true));
        assertEquals(2, config.getListProperty("list").size());
        assertTrue(config.getListProperty("missing").isEmpty());
        assertTrue(config.getMapProperty("string").isEmpty());
    }

    @Test
    void invalidNumber() {
        Map<String, Object> map = new HashMap<>();
        map.put("number", "forty");

        assertThrows(IllegalArgumentException.class, () -> new ConfigFoundation(map).getLongProperty("number"));
    }

    @Test
    void nullMap() {
        assertTrue(new ConfigFoundation((Map<String, Object>) null).getMap().isEmpty());
    }
}
