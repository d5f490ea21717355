package org.ascenoria.config;

import com.typesafe.config.Config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * The {@code content} block of the configuration, read once.
 *
 * @param basePath               Base pack data directory.
 * @param modsPath               Mods root directory.
 * @param supportedSchemaVersion Highest data schema version the runtime understands.
 * @param locales                Locales every localized text should provide.
 * @param hotReload              Hot-reload settings.
 */
public record ContentSettings(
        Path basePath,
        Path modsPath,
        int supportedSchemaVersion,
        List<String> locales,
        HotReload hotReload
) {

    /**
     * @param enabled       Whether the runtime watches the content directories.
     * @param debounce      Quiet period before a reload starts.
     * @param queueCapacity Capacity of the change event queue.
     * @param pollInterval  How often a running reload checks for newer changes.
     */
    public record HotReload(boolean enabled, Duration debounce, int queueCapacity, Duration pollInterval) {
    }

    public ContentSettings {
        locales = List.copyOf(locales);
        if (supportedSchemaVersion < 1) {
            throw new IllegalArgumentException("content.supported-schema-version must be at least 1");
        }
        if (hotReload.queueCapacity() < 1) {
            throw new IllegalArgumentException("content.hot-reload.queue-capacity must be at least 1");
        }
    }

    /**
     * Reads the settings from the {@code content} path of the configuration.
     *
     * @param config The application configuration; {@code reference.conf} supplies every default.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a value is missing or has the wrong type.
     */
    public static ContentSettings fromConfig(final Config config) {
        final Config content = config.getConfig("content");
        final Config reload = content.getConfig("hot-reload");
        return new ContentSettings(
                Path.of(content.getString("base-path")),
                Path.of(content.getString("mods-path")),
                content.getInt("supported-schema-version"),
                content.getStringList("locales"),
                new HotReload(
                        reload.getBoolean("enabled"),
                        reload.getDuration("debounce"),
                        reload.getInt("queue-capacity"),
                        reload.getDuration("poll-interval")));
    }

    /**
     * @return A copy pointing at other pack directories.
     */
    public ContentSettings withPaths(final Path base, final Path mods) {
        return new ContentSettings(base, mods, supportedSchemaVersion, locales, hotReload);
    }
}
