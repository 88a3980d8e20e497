package de.bsommerfeld.reddharvest.reddit;

import java.net.http.HttpHeaders;
import java.util.OptionalDouble;

/**
 * Reddit's {@code x-ratelimit-*} response headers. Values that were absent
 * or malformed are {@code -1}.
 *
 * @param remaining    requests left in the current window
 * @param used         requests used in the current window
 * @param resetSeconds seconds until the window resets
 */
public record RateLimitSnapshot(double remaining, double used, double resetSeconds) {

    public static final RateLimitSnapshot UNKNOWN = new RateLimitSnapshot(-1, -1, -1);

    public static RateLimitSnapshot fromHeaders(HttpHeaders headers) {
        return new RateLimitSnapshot(
                header(headers, "x-ratelimit-remaining").orElse(-1),
                header(headers, "x-ratelimit-used").orElse(-1),
                header(headers, "x-ratelimit-reset").orElse(-1));
    }

    public boolean isKnown() {
        return remaining >= 0;
    }

    /** Fewer than two requests left in the window. */
    public boolean isNearLimit() {
        return isKnown() && remaining < 2.0;
    }

    private static OptionalDouble header(HttpHeaders headers, String name) {
        return headers.firstValue(name)
                .map(value -> {
                    try {
                        return OptionalDouble.of(Double.parseDouble(value.strip()));
                    } catch (NumberFormatException e) {
                        return OptionalDouble.empty();
                    }
                })
                .orElse(OptionalDouble.empty());
    }
}
