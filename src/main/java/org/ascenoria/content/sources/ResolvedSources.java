package org.ascenoria.content.sources;

import java.util.List;

/**
 * The result of source resolution.
 *
 * @param sources         Packs in load order: the base pack, then mods by (priority, folder name).
 * @param manifestVersion The schema version declared by the base manifest.
 */
public record ResolvedSources(List<PackSource> sources, int manifestVersion) {

    public ResolvedSources {
        sources = List.copyOf(sources);
    }

    /**
     * @return The lowest schema version among the included packs, never above the manifest version.
     */
    public int effectiveSchemaVersion() {
        return sources.stream()
                .mapToInt(PackSource::schemaVersion)
                .reduce(manifestVersion, Math::min);
    }

    public List<String> names() {
        return sources.stream().map(PackSource::toString).toList();
    }
}
