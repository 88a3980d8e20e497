package de.bsommerfeld.reddharvest.harvester;

import de.bsommerfeld.reddharvest.core.domain.EntityKind;
import de.bsommerfeld.reddharvest.core.domain.TrackedEntity;
import de.bsommerfeld.reddharvest.core.util.StorageUtils;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Options of the {@code run} command.
 *
 * @param configFile     configuration file to load
 * @param subredditsOnly skip every tracked redditor
 * @param redditorsOnly  skip every tracked subreddit
 * @param onlyName       when non-empty, skip every entity with another name
 * @param debug          raise the root log level to DEBUG
 */
public record HarvestRunOptions(
        Path configFile,
        boolean subredditsOnly,
        boolean redditorsOnly,
        String onlyName,
        boolean debug) {

    public HarvestRunOptions {
        Objects.requireNonNull(configFile, "configFile");
        onlyName = onlyName == null ? "" : onlyName.strip();
    }

    /** Harvest everything from the default configuration file. */
    public static HarvestRunOptions defaults() {
        return new HarvestRunOptions(StorageUtils.getDefaultConfigFile(), false, false, "", false);
    }

    /**
     * Parses the arguments following {@code run}.
     *
     * @throws IllegalArgumentException on unknown options or a missing value
     */
    public static HarvestRunOptions parse(List<String> args) {
        Path configFile = StorageUtils.getDefaultConfigFile();
        boolean subredditsOnly = false;
        boolean redditorsOnly = false;
        String onlyName = "";
        boolean debug = false;

        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            switch (arg) {
                case "-c", "--config" -> configFile = StorageUtils.expandHome(valueOf(args, ++i, arg))
                        .toAbsolutePath().normalize();
                case "-s", "--subreddits-only" -> subredditsOnly = true;
                case "-r", "--redditors-only" -> redditorsOnly = true;
                case "-o", "--only-name" -> onlyName = valueOf(args, ++i, arg);
                case "--debug" -> debug = true;
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
        return new HarvestRunOptions(configFile, subredditsOnly, redditorsOnly, onlyName, debug);
    }

    private static String valueOf(List<String> args, int index, String option) {
        if (index >= args.size() || args.get(index).isBlank()) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args.get(index);
    }

    /** Why the entity is excluded from this run, or empty if it is harvested. */
    public Optional<String> skipReason(TrackedEntity entity) {
        if (subredditsOnly && entity.kind() == EntityKind.SOURCE_ACCOUNT) {
            return Optional.of("configured to skip redditors");
        }
        if (redditorsOnly && entity.kind() == EntityKind.COMMUNITY) {
            return Optional.of("configured to skip subreddits");
        }
        if (!onlyName.isEmpty() && !onlyName.equals(entity.name())) {
            return Optional.of("configured to only retrieve from '" + onlyName + "'");
        }
        return Optional.empty();
    }
}
