package de.bsommerfeld.reddharvest.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Decides where posts come from. {@link #PROD} lists submissions from
 * Reddit; {@link #TEST} binds an offline post source so that a run touches
 * neither Reddit nor any media host.
 *
 * <p>
 * Selected through the {@value #PROPERTY} system property, falling back to
 * the {@value #ENVIRONMENT} environment variable.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    public static final String PROPERTY = "app.mode";
    public static final String ENVIRONMENT = "APP_MODE";

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    public static ApplicationMode get() {
        String property = System.getProperty(PROPERTY);
        return resolve(property != null && !property.isBlank() ? property : System.getenv(ENVIRONMENT));
    }

    /** Case-insensitive; blank or unknown values resolve to {@link #PROD}. */
    static ApplicationMode resolve(String value) {
        if (value == null || value.isBlank()) {
            return PROD;
        }
        try {
            return valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}'. Harvesting from Reddit.", value);
            return PROD;
        }
    }

    public boolean isOffline() {
        return this == TEST;
    }
}
