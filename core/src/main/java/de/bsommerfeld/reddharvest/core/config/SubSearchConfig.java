package de.bsommerfeld.reddharvest.core.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SubSearchConfig {

    @JsonProperty("extension")
    private String extension;

    @JsonProperty("page-search-regex")
    @JsonAlias("page_search_regex")
    private String pageSearchRegex;

    public String getExtension() {
        return extension;
    }

    public String getPageSearchRegex() {
        return pageSearchRegex;
    }
}
