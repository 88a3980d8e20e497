package de.bsommerfeld.reddharvest.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Raw entry of the {@code ignored-redditors} or {@code ignored-subreddits} list. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IgnoredConfig {

    @JsonProperty("name")
    private String name;

    public String getName() {
        return name;
    }
}
