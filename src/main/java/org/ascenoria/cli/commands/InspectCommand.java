package org.ascenoria.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonSerializer;
import org.ascenoria.cli.CommandLineInterface;
import org.ascenoria.config.ContentSettings;
import org.ascenoria.content.api.ContentLoadException;
import org.ascenoria.content.api.Snapshot;
import org.ascenoria.content.derived.DerivedStats;
import org.ascenoria.content.diagnostics.Diagnostic;
import org.ascenoria.content.model.CollectionType;
import org.ascenoria.content.model.ContentCollections;
import org.ascenoria.content.model.ContentRecord;
import org.ascenoria.content.model.LocalizedText;
import org.ascenoria.content.pipeline.ContentPipeline;
import org.ascenoria.content.registry.GameRegistry;
import org.ascenoria.content.registry.RegistryIndex;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "inspect", description = "Loads the content once and prints the records of a collection with their derived stats as JSON.")
public class InspectCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", paramLabel = "COLLECTION", description = "Collection name, e.g. weapon or surface_building.")
    private String collectionName;

    @Parameters(index = "1", arity = "0..1", paramLabel = "ID", description = "Only print this record.")
    private String id;

    @Option(names = {"-b", "--base"}, paramLabel = "DIR", description = "Base pack data directory.")
    private File base;

    @Option(names = {"-m", "--mods"}, paramLabel = "DIR", description = "Mods root.")
    private File mods;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .registerTypeAdapter(LocalizedText.class,
                    (JsonSerializer<LocalizedText>) (text, type, context) -> context.serialize(text.asMap()))
            .create();

    @Override
    public Integer call() {
        final PrintWriter err = spec.commandLine().getErr();
        final Optional<CollectionType<?, ?>> collection = ContentCollections.byName(collectionName);
        if (collection.isEmpty()) {
            err.println("Unknown collection '" + collectionName + "'. Known collections: "
                    + ContentCollections.ALL.stream().map(CollectionType::name).toList());
            return 1;
        }

        final ContentSettings settings = PackPaths.resolve(ContentSettings.fromConfig(parent.getConfig()), base, mods);
        final Snapshot snapshot;
        try {
            snapshot = ContentPipeline.fromSettings(settings).load();
        } catch (ContentLoadException e) {
            err.println(e.getMessage());
            for (Diagnostic diagnostic : e.fatalDiagnostics()) {
                err.println("  " + diagnostic);
            }
            return 1;
        }

        final JsonObject result = new JsonObject();
        result.addProperty("collection", collection.get().name());
        result.addProperty("generation", snapshot.generation());
        final JsonArray records = new JsonArray();
        if (!appendRecords(snapshot, collection.get(), records)) {
            err.println("No " + collectionName + " with id '" + id + "'");
            return 1;
        }
        result.add("records", records);

        final PrintWriter out = spec.commandLine().getOut();
        out.println(gson.toJson(result));
        out.flush();
        return 0;
    }

    private <R extends ContentRecord, D extends DerivedStats> boolean appendRecords(
            Snapshot snapshot, CollectionType<R, D> collection, JsonArray target) {
        final GameRegistry registry = snapshot.registry();
        if (id != null) {
            final Optional<RegistryIndex<R>> index = registry.resolve(collection, id);
            if (index.isEmpty()) {
                return false;
            }
            target.add(describe(snapshot, collection, index.get()));
            return true;
        }
        for (String key : registry.keys(collection)) {
            registry.resolve(collection, key).ifPresent(index -> target.add(describe(snapshot, collection, index)));
        }
        return true;
    }

    private <R extends ContentRecord, D extends DerivedStats> JsonObject describe(
            Snapshot snapshot, CollectionType<R, D> collection, RegistryIndex<R> index) {
        final GameRegistry registry = snapshot.registry();
        final R record = registry.get(collection, index);
        final JsonObject entry = new JsonObject();
        entry.addProperty("index", index.value());
        entry.addProperty("key", record.key());
        entry.addProperty("source", snapshot.sourceOf(collection, record.key()).orElse(null));
        entry.add("record", gson.toJsonTree(record));
        entry.add("derived", gson.toJsonTree(registry.getDerived(collection, index)));
        return entry;
    }
}
