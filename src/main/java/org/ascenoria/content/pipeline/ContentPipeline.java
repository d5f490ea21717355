package org.ascenoria.content.pipeline;

import org.ascenoria.config.ContentSettings;
import org.ascenoria.content.api.CancellationSignal;
import org.ascenoria.content.api.ContentLoadException;
import org.ascenoria.content.api.Snapshot;
import org.ascenoria.content.decode.DecodedSource;
import org.ascenoria.content.decode.FileDecoder;
import org.ascenoria.content.decode.PackDecoder;
import org.ascenoria.content.derived.DerivedStatCompiler;
import org.ascenoria.content.derived.DerivedStatsTable;
import org.ascenoria.content.diagnostics.DiagnosticsEngine;
import org.ascenoria.content.merge.MergeEngine;
import org.ascenoria.content.merge.MergedCollection;
import org.ascenoria.content.merge.MergedContent;
import org.ascenoria.content.model.CollectionType;
import org.ascenoria.content.registry.GameRegistry;
import org.ascenoria.content.registry.RegistryBuilder;
import org.ascenoria.content.sources.PackSource;
import org.ascenoria.content.sources.ResolvedSources;
import org.ascenoria.content.sources.SourceResolver;
import org.ascenoria.content.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the content stages in order: resolve, decode, merge, validate, derive, build registry.
 * <p>
 * Each run uses its own diagnostics and touches no shared mutable state except the generation
 * counter, so runs are deterministic and a failed or cancelled run leaves nothing behind.
 */
public class ContentPipeline implements SnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(ContentPipeline.class);

    private final Path baseDirectory;
    private final Path modsDirectory;
    private final SourceResolver resolver;
    private final PackDecoder packDecoder;
    private final MergeEngine mergeEngine = new MergeEngine();
    private final Validator validator;
    private final DerivedStatCompiler statCompiler = new DerivedStatCompiler();
    private final RegistryBuilder registryBuilder = new RegistryBuilder();
    private final AtomicLong generations = new AtomicLong();

    /**
     * @param baseDirectory          The base pack's data directory.
     * @param modsDirectory          The mods root; may be missing on disk or {@code null}.
     * @param supportedSchemaVersion The highest schema version this runtime understands.
     * @param locales                Locales the localization rule checks for.
     */
    public ContentPipeline(Path baseDirectory, Path modsDirectory, int supportedSchemaVersion, List<String> locales) {
        final FileDecoder fileDecoder = new FileDecoder();
        this.baseDirectory = baseDirectory;
        this.modsDirectory = modsDirectory;
        this.resolver = new SourceResolver(fileDecoder, supportedSchemaVersion);
        this.packDecoder = new PackDecoder(fileDecoder);
        this.validator = Validator.standard(locales);
    }

    public static ContentPipeline fromSettings(ContentSettings settings) {
        return new ContentPipeline(settings.basePath(), settings.modsPath(), settings.supportedSchemaVersion(),
                settings.locales());
    }

    public Path baseDirectory() {
        return baseDirectory;
    }

    public Path modsDirectory() {
        return modsDirectory;
    }

    /**
     * Loads with no cancellation.
     *
     * @return The snapshot.
     * @throws ContentLoadException if the load has fatal diagnostics.
     */
    public Snapshot load() throws ContentLoadException {
        return load(CancellationSignal.NONE);
    }

    @Override
    public Snapshot load(CancellationSignal signal) throws ContentLoadException {
        final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        final Optional<Stage> stage = mergeAndValidate(diagnostics, signal);
        if (stage.isEmpty() || diagnostics.hasFatal()) {
            throw new ContentLoadException(String.format("Content load aborted with %d fatal diagnostic(s)",
                    diagnostics.fatalCount()), diagnostics.getDiagnostics());
        }
        final MergedContent merged = stage.get().merged();

        signal.throwIfCancelled();
        final DerivedStatsTable stats = statCompiler.compile(merged);

        signal.throwIfCancelled();
        final long generation = generations.incrementAndGet();
        final GameRegistry registry = registryBuilder.build(merged, stats, generation);

        final Map<CollectionType<?, ?>, Map<String, String>> trail = new LinkedHashMap<>();
        for (MergedCollection<?> collection : merged.all()) {
            trail.put(collection.type(), collection.lastWriters());
        }
        final List<String> sourceNames = merged.sources().stream().map(PackSource::toString).toList();
        final int effectiveVersion = merged.sources().stream()
                .mapToInt(PackSource::schemaVersion)
                .reduce(stage.get().resolved().manifestVersion(), Math::min);

        log.debug("Loaded content generation {} from {}", generation, sourceNames);
        return new Snapshot(generation, registry, diagnostics.getDiagnostics(), effectiveVersion, sourceNames, trail,
                Instant.now());
    }

    /**
     * Runs resolution, decoding, merging and validation without building a registry.
     *
     * @return Every diagnostic of the run.
     */
    public LintReport lint() {
        final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        final Optional<Stage> stage = mergeAndValidate(diagnostics, CancellationSignal.NONE);
        final List<String> sources = stage.map(s -> s.resolved().names()).orElse(List.of());
        return new LintReport(diagnostics.getDiagnostics(), sources);
    }

    private Optional<Stage> mergeAndValidate(DiagnosticsEngine diagnostics, CancellationSignal signal) {
        signal.throwIfCancelled();
        final Optional<ResolvedSources> resolved = resolver.resolve(baseDirectory, modsDirectory, diagnostics);
        if (resolved.isEmpty()) {
            return Optional.empty();
        }

        final List<DecodedSource> decoded = new ArrayList<>();
        for (PackSource source : resolved.get().sources()) {
            packDecoder.decode(source, diagnostics, signal).ifPresent(decoded::add);
        }
        if (diagnostics.hasFatal()) {
            return Optional.empty();
        }

        signal.throwIfCancelled();
        final MergedContent merged = mergeEngine.merge(decoded);

        signal.throwIfCancelled();
        validator.validate(merged, diagnostics);
        return Optional.of(new Stage(resolved.get(), merged));
    }

    /**
     * Output of the stages shared by loading and linting.
     */
    private record Stage(ResolvedSources resolved, MergedContent merged) {
    }
}
