package de.bsommerfeld.reddharvest.retrieval.download;

/** Coarse payload category, also the folder name used when media is separated. */
public enum MediaKind {

    IMAGE("images"),
    VIDEO("videos"),
    UNKNOWN("unknown");

    private final String folderName;

    MediaKind(String folderName) {
        this.folderName = folderName;
    }

    public String folderName() {
        return folderName;
    }
}
