package org.ascenoria.content.sources;

import org.ascenoria.content.api.ContentSourceException;
import org.ascenoria.content.api.SchemaVersionRejectedException;
import org.ascenoria.content.decode.DataFormat;
import org.ascenoria.content.decode.FileDecoder;
import org.ascenoria.content.diagnostics.DiagnosticCode;
import org.ascenoria.content.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Enumerates the base pack and every mod pack and puts them into load order.
 * <p>
 * The base pack always comes first. Mods follow sorted by priority ascending, ties broken by
 * folder name ascending, so that the order is independent of directory enumeration order.
 * A mod whose descriptor is broken or declares a schema version newer than the manifest is
 * skipped with a warning; resolution of the remaining mods is unaffected.
 */
public class SourceResolver {

    private static final Logger log = LoggerFactory.getLogger(SourceResolver.class);

    /** Base name of the base pack's manifest file. */
    public static final String MANIFEST_FILE = "manifest";
    /** Base name of the optional mod descriptor, located at the mod root. */
    public static final String MOD_DESCRIPTOR_FILE = "mod";
    /** Directory inside a mod that holds its collection files. */
    public static final String MOD_DATA_DIRECTORY = "data";

    private static final Comparator<PackSource> LOAD_ORDER = Comparator
            .comparingInt(PackSource::priority)
            .thenComparing(PackSource::name);

    private final FileDecoder decoder;
    private final int supportedSchemaVersion;

    /**
     * @param decoder                The decoder used for manifest and descriptor files.
     * @param supportedSchemaVersion The highest schema version this runtime understands.
     */
    public SourceResolver(FileDecoder decoder, int supportedSchemaVersion) {
        this.decoder = decoder;
        this.supportedSchemaVersion = supportedSchemaVersion;
    }

    /**
     * Resolves the packs to load.
     *
     * @param baseDirectory The base pack's data directory.
     * @param modsDirectory The mods root, or {@code null} for no mods.
     * @param diagnostics   Receives skipped-mod warnings and fatal base pack problems.
     * @return The ordered sources, or empty if the base pack itself is unusable.
     */
    public Optional<ResolvedSources> resolve(Path baseDirectory, Path modsDirectory, DiagnosticsEngine diagnostics) {
        if (!Files.isDirectory(baseDirectory)) {
            diagnostics.reportFatal(DiagnosticCode.IO_ERROR, null, null, PackSource.BASE_NAME,
                    "base data directory does not exist: " + baseDirectory);
            return Optional.empty();
        }

        final int manifestVersion;
        try {
            manifestVersion = readManifestVersion(baseDirectory);
        } catch (ContentSourceException e) {
            diagnostics.reportFatal(e.code(), null, null, PackSource.BASE_NAME,
                    e.path().getFileName() + ": " + e.getMessage());
            return Optional.empty();
        }

        final List<PackSource> sources = new ArrayList<>();
        sources.add(new PackSource(PackSource.BASE_NAME, baseDirectory, SourceKind.BASE, 0, manifestVersion));

        final List<PackSource> mods = new ArrayList<>();
        for (Path modRoot : listModDirectories(modsDirectory, diagnostics)) {
            resolveMod(modRoot, manifestVersion, diagnostics).ifPresent(mods::add);
        }
        mods.sort(LOAD_ORDER);
        sources.addAll(mods);

        log.debug("Resolved {} source(s), manifest schema version {}", sources.size(), manifestVersion);
        return Optional.of(new ResolvedSources(sources, manifestVersion));
    }

    private int readManifestVersion(Path baseDirectory) throws ContentSourceException {
        final List<Path> candidates = DataFormat.candidates(baseDirectory, MANIFEST_FILE);
        if (candidates.isEmpty()) {
            return supportedSchemaVersion;
        }
        final Path file = candidates.get(0);
        final Manifest manifest = decoder.decodeDocument(file, Manifest.class);
        if (manifest.schemaVersion() > supportedSchemaVersion) {
            throw new SchemaVersionRejectedException(file, manifest.schemaVersion(), supportedSchemaVersion);
        }
        return manifest.schemaVersion();
    }

    private List<Path> listModDirectories(Path modsDirectory, DiagnosticsEngine diagnostics) {
        if (modsDirectory == null || !Files.isDirectory(modsDirectory)) {
            log.debug("No mods directory at {}", modsDirectory);
            return List.of();
        }
        try (Stream<Path> entries = Files.list(modsDirectory)) {
            return entries
                    .filter(Files::isDirectory)
                    .filter(dir -> Files.isDirectory(dir.resolve(MOD_DATA_DIRECTORY)))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            diagnostics.reportWarning(DiagnosticCode.IO_ERROR, null, null, modsDirectory.toString(),
                    "cannot list mods directory: " + e.getMessage());
            log.warn("Cannot list mods directory {}, continuing without mods", modsDirectory);
            log.debug("Exception details:", e);
            return List.of();
        }
    }

    private Optional<PackSource> resolveMod(Path modRoot, int manifestVersion, DiagnosticsEngine diagnostics) {
        final String name = modRoot.getFileName().toString();
        final String sourceName = "mod:" + name;
        try {
            int priority = 0;
            int schemaVersion = manifestVersion;
            final List<Path> candidates = DataFormat.candidates(modRoot, MOD_DESCRIPTOR_FILE);
            if (!candidates.isEmpty()) {
                final ModDescriptor descriptor = decoder.decodeDocument(candidates.get(0), ModDescriptor.class);
                if (descriptor.priority() != null) {
                    priority = descriptor.priority();
                }
                if (descriptor.schemaVersion() != null) {
                    schemaVersion = descriptor.schemaVersion();
                }
            }
            if (schemaVersion > manifestVersion) {
                throw new SchemaVersionRejectedException(modRoot, schemaVersion, manifestVersion);
            }
            log.debug("Found mod '{}' (priority {}, schema version {})", name, priority, schemaVersion);
            return Optional.of(new PackSource(name, modRoot.resolve(MOD_DATA_DIRECTORY), SourceKind.MOD,
                    priority, schemaVersion));
        } catch (ContentSourceException e) {
            diagnostics.reportWarning(e.code(), null, null, sourceName, "mod skipped: " + e.getMessage());
            log.warn("Skipping mod '{}': {}", name, e.getMessage());
            return Optional.empty();
        }
    }
}
