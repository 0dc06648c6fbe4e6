package com.mlbbai.hero_analysis_engine.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValidationUtilsTest {

    @Test
    void containsIgnoreCaseTreatsBlankNeedleAsMatch() {
        assertTrue(ValidationUtils.containsIgnoreCase("Fighter/Assassin", "assassin"));
        assertTrue(ValidationUtils.containsIgnoreCase("Tank", " "));
        assertTrue(ValidationUtils.containsIgnoreCase(null, null));
        assertFalse(ValidationUtils.containsIgnoreCase(null, "tank"));
        assertFalse(ValidationUtils.containsIgnoreCase("Mage", "tank"));
    }

    @Test
    void normalizeKeyTrimsAndLowerCases() {
        assertEquals("yi sun-shin", ValidationUtils.normalizeKey("  Yi Sun-shin "));
        assertEquals("", ValidationUtils.normalizeKey(null));
    }

    @Test
    void parseIntOrDefaultFallsBackOnUnparseableInput() {
        assertEquals(5, ValidationUtils.parseIntOrDefault(" 5 ", 50));
        assertEquals(-3, ValidationUtils.parseIntOrDefault("-3", 50));
        assertEquals(50, ValidationUtils.parseIntOrDefault("abc", 50));
        assertEquals(50, ValidationUtils.parseIntOrDefault("", 50));
        assertEquals(50, ValidationUtils.parseIntOrDefault(null, 50));
        assertEquals(50, ValidationUtils.parseIntOrDefault("99999999999", 50));
    }
}
