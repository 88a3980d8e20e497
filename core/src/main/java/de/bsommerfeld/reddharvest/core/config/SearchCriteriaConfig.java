package de.bsommerfeld.reddharvest.core.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Raw {@code search-criteria} block of a redditor or subreddit entry. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchCriteriaConfig {

    /** {@code null} means "use the global post limit". */
    @JsonProperty("post-limit")
    @JsonAlias("post_limit")
    private Integer postLimit;

    @JsonProperty("sort-type")
    @JsonAlias("sort_type")
    private String sortType = "new";

    @JsonProperty("sort-toggle")
    @JsonAlias("sort_toggle")
    private String sortToggle;

    public Integer getPostLimit() {
        return postLimit;
    }

    public String getSortType() {
        return sortType;
    }

    public String getSortToggle() {
        return sortToggle;
    }
}
