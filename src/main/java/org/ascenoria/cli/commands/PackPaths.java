package org.ascenoria.cli.commands;

import org.ascenoria.config.ContentSettings;

import java.io.File;
import java.nio.file.Path;

/**
 * Applies pack directories given on the command line to the configured settings.
 */
final class PackPaths {

    private static final String MODS_DIRECTORY = "mods";

    private PackPaths() {
    }

    static ContentSettings resolve(ContentSettings settings, File base, File mods) {
        if (base == null && mods == null) {
            return settings;
        }
        final Path basePath = base != null ? base.toPath() : settings.basePath();
        final Path modsPath;
        if (mods != null) {
            modsPath = mods.toPath();
        } else if (base != null) {
            final Path parent = base.toPath().toAbsolutePath().getParent();
            modsPath = parent != null ? parent.resolve(MODS_DIRECTORY) : settings.modsPath();
        } else {
            modsPath = settings.modsPath();
        }
        return settings.withPaths(basePath, modsPath);
    }
}
