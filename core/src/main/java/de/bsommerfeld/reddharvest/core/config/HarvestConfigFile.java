package de.bsommerfeld.reddharvest.core.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the YAML configuration file as written by users. Lists that are
 * absent or explicitly {@code null} are treated as empty by
 * {@link HarvestConfigLoader}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HarvestConfigFile {

    @JsonProperty("globals")
    private GlobalsConfig globals = new GlobalsConfig();

    @JsonProperty("redditors")
    private List<EntityConfig> redditors = new ArrayList<>();

    @JsonProperty("subreddits")
    private List<EntityConfig> subreddits = new ArrayList<>();

    @JsonProperty("ignored-redditors")
    @JsonAlias("ignored_redditors")
    private List<IgnoredConfig> ignoredRedditors = new ArrayList<>();

    @JsonProperty("ignored-subreddits")
    @JsonAlias("ignored_subreddits")
    private List<IgnoredConfig> ignoredSubreddits = new ArrayList<>();

    @JsonProperty("links")
    private List<LinkConfig> links = new ArrayList<>();

    public GlobalsConfig getGlobals() {
        return globals;
    }

    public List<EntityConfig> getRedditors() {
        return redditors;
    }

    public List<EntityConfig> getSubreddits() {
        return subreddits;
    }

    public List<IgnoredConfig> getIgnoredRedditors() {
        return ignoredRedditors;
    }

    public List<IgnoredConfig> getIgnoredSubreddits() {
        return ignoredSubreddits;
    }

    public List<LinkConfig> getLinks() {
        return links;
    }
}
