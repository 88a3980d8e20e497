package de.bsommerfeld.reddharvest.core.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw entry of the {@code redditors} or {@code subreddits} list. The store
 * type default depends on the list the entry appears in and is applied by
 * {@link HarvestConfigLoader}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EntityConfig {

    @JsonProperty("name")
    private String name;

    @JsonProperty("alias")
    private String alias;

    @JsonProperty("store-type")
    @JsonAlias("store_type")
    private String storeType;

    @JsonProperty("search-criteria")
    @JsonAlias("search_criteria")
    private SearchCriteriaConfig searchCriteria = new SearchCriteriaConfig();

    public String getName() {
        return name;
    }

    public String getAlias() {
        return alias;
    }

    public String getStoreType() {
        return storeType;
    }

    public SearchCriteriaConfig getSearchCriteria() {
        return searchCriteria;
    }
}
