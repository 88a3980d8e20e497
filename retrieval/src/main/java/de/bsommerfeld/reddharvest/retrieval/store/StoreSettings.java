package de.bsommerfeld.reddharvest.retrieval.store;

import de.bsommerfeld.reddharvest.core.config.HarvestSettings;

import java.nio.file.Path;
import java.util.Objects;

/**
 * @param root          download root
 * @param separateMedia whether a media-kind folder sits between the root
 *                      and the entity folder
 */
public record StoreSettings(Path root, boolean separateMedia) {

    public StoreSettings {
        Objects.requireNonNull(root, "root");
    }

    public static StoreSettings from(HarvestSettings settings) {
        return new StoreSettings(settings.downloadRoot(), settings.separateMedia());
    }
}
