package de.bsommerfeld.reddharvest.core.domain;

import java.util.Objects;

/** A followed subreddit. */
public record Community(String name, String alias, StoreType storeType, SearchCriteria searchCriteria)
        implements TrackedEntity {

    /** Subreddits are stored nested unless configured otherwise. */
    public static final StoreType DEFAULT_STORE_TYPE = StoreType.NESTED;

    public Community {
        Objects.requireNonNull(name, "name");
        name = name.strip();
        alias = TrackedEntity.aliasOrName(alias, name);
        storeType = storeType == null ? DEFAULT_STORE_TYPE : storeType;
        Objects.requireNonNull(searchCriteria, "searchCriteria");
    }

    @Override
    public EntityKind kind() {
        return EntityKind.COMMUNITY;
    }
}
