package de.bsommerfeld.reddharvest.core.domain;

/** Result category of materializing one candidate URL. */
public enum RetrievalStatus {

    /** Bytes were written under a new digest. */
    NEW_SAVED,

    /** A file with the same digest already exists in the destination folder. */
    ALREADY_SAVED,

    /** Nothing matched, or fetching/parsing failed. */
    NOT_SAVED,

    /** Author or subreddit is on an ignore list; nothing was fetched. */
    IGNORED,

    /** Adult content while adult content is not allowed; nothing was fetched. */
    AGE_RESTRICTED
}
