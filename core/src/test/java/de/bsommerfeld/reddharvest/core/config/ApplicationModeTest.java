package de.bsommerfeld.reddharvest.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationModeTest {

    @Test
    void resolve_shouldBeCaseInsensitive() {
        assertEquals(ApplicationMode.TEST, ApplicationMode.resolve("test"));
        assertEquals(ApplicationMode.TEST, ApplicationMode.resolve(" TEST "));
        assertEquals(ApplicationMode.PROD, ApplicationMode.resolve("Prod"));
    }

    @Test
    void resolve_shouldDefaultToProd() {
        assertEquals(ApplicationMode.PROD, ApplicationMode.resolve(null));
        assertEquals(ApplicationMode.PROD, ApplicationMode.resolve(""));
        assertEquals(ApplicationMode.PROD, ApplicationMode.resolve("INVALID_GARBAGE"));
    }

    @Test
    void get_shouldPreferSystemProperty() {
        String original = System.getProperty(ApplicationMode.PROPERTY);
        try {
            System.setProperty(ApplicationMode.PROPERTY, "test");
            assertEquals(ApplicationMode.TEST, ApplicationMode.get());
        } finally {
            if (original != null) {
                System.setProperty(ApplicationMode.PROPERTY, original);
            } else {
                System.clearProperty(ApplicationMode.PROPERTY);
            }
        }
    }

    @Test
    void isOffline_shouldOnlyBeTrueForTestMode() {
        assertTrue(ApplicationMode.TEST.isOffline());
        assertFalse(ApplicationMode.PROD.isOffline());
    }
}
