package io.relayindex.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class RelayIndexConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DEFAULT_RELAY_LIST_FILE = "relays.json";

    private final Path rootDir;
    private final Path relayListFile;

    public RelayIndexConfig(Path rootDir, Path relayListFile) {
        this.rootDir = rootDir;
        this.relayListFile = relayListFile;
    }

    public static RelayIndexConfig fromRoot(String root) {
        return fromRoot(root, null);
    }

    /**
     * Resolves the data root and the relay list file. A blank {@code relayListFile} falls back to
     * {@code <root>/relays.json}; anything else is taken as given, relative to the working directory.
     */
    public static RelayIndexConfig fromRoot(String root, String relayListFile) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root.trim());
        Path base = resolved.toAbsolutePath().normalize();
        Path file = relayListFile == null || relayListFile.isBlank()
                ? base.resolve(DEFAULT_RELAY_LIST_FILE)
                : Paths.get(relayListFile.trim()).toAbsolutePath().normalize();
        return new RelayIndexConfig(base, file);
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path relayListFile() {
        return relayListFile;
    }
}
