package org.ascenoria.content.sources;

import java.nio.file.Path;

/**
 * One resolved pack, ready to be decoded.
 *
 * @param name          The pack name: {@code base} or the mod folder name.
 * @param dataDirectory Directory holding the collection files.
 * @param kind          Base pack or mod.
 * @param priority      Merge priority; higher loads later.
 * @param schemaVersion The schema version the pack declares (or inherits).
 */
public record PackSource(String name, Path dataDirectory, SourceKind kind, int priority, int schemaVersion) {

    public static final String BASE_NAME = "base";

    public boolean isBase() {
        return kind == SourceKind.BASE;
    }

    @Override
    public String toString() {
        return kind == SourceKind.BASE ? BASE_NAME : "mod:" + name;
    }
}
