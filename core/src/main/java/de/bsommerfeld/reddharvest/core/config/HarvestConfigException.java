package de.bsommerfeld.reddharvest.core.config;

/**
 * Thrown when the configuration file cannot be read or is structurally
 * invalid. Unsupported enum values never cause this; they fall back to
 * their documented defaults.
 */
public class HarvestConfigException extends RuntimeException {

    public HarvestConfigException(String message) {
        super(message);
    }

    public HarvestConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
