package de.bsommerfeld.reddharvest.core.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The {@code globals} section of the configuration file. Field values are
 * the defaults applied when a key is absent; credentials of the original
 * file format are tolerated and ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GlobalsConfig {

    @JsonProperty("app")
    private String app = "redd-harvest";

    @JsonProperty("username")
    private String username = "unknown";

    @JsonProperty("post-limit")
    @JsonAlias("post_limit")
    private int postLimit = 5;

    @JsonProperty("rate-limit-max-wait")
    @JsonAlias("rate_limit_max_wait")
    private long rateLimitMaxWait = 120;

    @JsonProperty("backoff-sleep")
    @JsonAlias("backoff_sleep")
    private double backoffSleep = 0.1;

    @JsonProperty("download-folder")
    @JsonAlias("download_folder")
    private String downloadFolder = "~/.redd-harvest/data";

    @JsonProperty("separate-media")
    @JsonAlias("separate_media")
    private boolean separateMedia = true;

    @JsonProperty("prune-ignorables")
    @JsonAlias("prune_ignorables")
    private boolean pruneIgnorables = false;

    @JsonProperty("favor-entity")
    @JsonAlias("favor_entity")
    private String favorEntity = "redditor";

    // adult content pass-through
    @JsonProperty("bonk")
    private boolean bonk = false;

    @JsonProperty("download-threads")
    @JsonAlias("download_threads")
    private int downloadThreads = 1;

    public String getApp() {
        return app;
    }

    public String getUsername() {
        return username;
    }

    public int getPostLimit() {
        return postLimit;
    }

    public long getRateLimitMaxWait() {
        return rateLimitMaxWait;
    }

    public double getBackoffSleep() {
        return backoffSleep;
    }

    public String getDownloadFolder() {
        return downloadFolder;
    }

    public boolean isSeparateMedia() {
        return separateMedia;
    }

    public boolean isPruneIgnorables() {
        return pruneIgnorables;
    }

    public String getFavorEntity() {
        return favorEntity;
    }

    public boolean isBonk() {
        return bonk;
    }

    public int getDownloadThreads() {
        return downloadThreads;
    }
}
