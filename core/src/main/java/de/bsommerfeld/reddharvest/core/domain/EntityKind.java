package de.bsommerfeld.reddharvest.core.domain;

/** Discriminator of the two {@link TrackedEntity} variants. */
public enum EntityKind {
    SOURCE_ACCOUNT,
    COMMUNITY
}
