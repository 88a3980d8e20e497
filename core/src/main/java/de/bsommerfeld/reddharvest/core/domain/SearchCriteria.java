package de.bsommerfeld.reddharvest.core.domain;

import java.util.Objects;

/**
 * How submissions are requested from a tracked entity.
 *
 * @param sortType   listing sort order
 * @param sortToggle time window, only present for sorts that
 *                   {@linkplain SortType#supportsToggle() support one}
 * @param postLimit  maximum number of posts processed per run
 */
public record SearchCriteria(SortType sortType, SortToggle sortToggle, int postLimit) {

    public SearchCriteria {
        Objects.requireNonNull(sortType, "sortType");
        if (sortType.supportsToggle()) {
            sortToggle = sortToggle == null ? SortToggle.DEFAULT : sortToggle;
        } else {
            sortToggle = null;
        }
        if (postLimit < 0) {
            throw new IllegalArgumentException("postLimit must not be negative: " + postLimit);
        }
    }

    /**
     * Builds criteria from raw configuration values, applying the documented
     * defaults for missing or unsupported values.
     */
    public static SearchCriteria fromConfig(String sortType, String sortToggle, int postLimit) {
        SortType type = SortType.fromConfig(sortType);
        SortToggle toggle = type.supportsToggle() ? SortToggle.fromConfig(sortToggle) : null;
        return new SearchCriteria(type, toggle, postLimit);
    }

    public SearchCriteria withSortType(SortType type) {
        return new SearchCriteria(type, sortToggle, postLimit);
    }
}
