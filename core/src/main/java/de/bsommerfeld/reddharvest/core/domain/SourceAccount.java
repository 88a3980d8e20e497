package de.bsommerfeld.reddharvest.core.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * A followed redditor. Redditor listings support fewer sort orders than
 * subreddit listings, so unsupported sorts are replaced with
 * {@link SortType#NEW} on construction.
 */
public record SourceAccount(String name, String alias, StoreType storeType, SearchCriteria searchCriteria)
        implements TrackedEntity {

    private static final Logger LOG = LoggerFactory.getLogger(SourceAccount.class);

    /** Redditors are stored flat unless configured otherwise. */
    public static final StoreType DEFAULT_STORE_TYPE = StoreType.FLAT;

    public SourceAccount {
        Objects.requireNonNull(name, "name");
        name = name.strip();
        alias = TrackedEntity.aliasOrName(alias, name);
        storeType = storeType == null ? DEFAULT_STORE_TYPE : storeType;
        Objects.requireNonNull(searchCriteria, "searchCriteria");
        if (!SortType.ACCOUNT_SORT_TYPES.contains(searchCriteria.sortType())) {
            LOG.warn("Sort type '{}' is not available for redditor '{}'. Defaulting to {}.",
                    searchCriteria.sortType().configName(), name, SortType.NEW.configName());
            searchCriteria = searchCriteria.withSortType(SortType.NEW);
        }
    }

    @Override
    public EntityKind kind() {
        return EntityKind.SOURCE_ACCOUNT;
    }
}
