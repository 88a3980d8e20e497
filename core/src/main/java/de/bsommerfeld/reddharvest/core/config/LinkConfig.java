package de.bsommerfeld.reddharvest.core.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/** Raw entry of the {@code links} list. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LinkConfig {

    @JsonProperty("base-url")
    @JsonAlias("base_url")
    private String baseUrl;

    @JsonProperty("direct-dl-url-extensions")
    @JsonAlias("direct_dl_url_extensions")
    private List<String> directDownloadExtensions = new ArrayList<>();

    @JsonProperty("sub-searches")
    @JsonAlias("sub_searches")
    private List<SubSearchConfig> subSearches = new ArrayList<>();

    public String getBaseUrl() {
        return baseUrl;
    }

    public List<String> getDirectDownloadExtensions() {
        return directDownloadExtensions;
    }

    public List<SubSearchConfig> getSubSearches() {
        return subSearches;
    }
}
