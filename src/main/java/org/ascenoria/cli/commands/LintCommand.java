package org.ascenoria.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.ascenoria.cli.CommandLineInterface;
import org.ascenoria.config.ContentSettings;
import org.ascenoria.content.diagnostics.Diagnostic;
import org.ascenoria.content.pipeline.ContentPipeline;
import org.ascenoria.content.pipeline.LintReport;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "lint", description = "Checks the content packs and prints all diagnostics. Exits with 1 if any is fatal.")
public class LintCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", arity = "0..1", paramLabel = "BASE",
            description = "Base pack data directory (default: content.base-path).")
    private File base;

    @Option(names = {"-m", "--mods"}, paramLabel = "DIR",
            description = "Mods root (default: BASE/../mods when BASE is given, otherwise content.mods-path).")
    private File mods;

    @Option(names = "--json", description = "Print the report as JSON.")
    private boolean json;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final ContentSettings settings = PackPaths.resolve(ContentSettings.fromConfig(parent.getConfig()), base, mods);
        final LintReport report = ContentPipeline.fromSettings(settings).lint();

        final PrintWriter out = spec.commandLine().getOut();
        if (json) {
            final Gson gson = new GsonBuilder().setPrettyPrinting().create();
            out.println(gson.toJson(report));
        } else {
            out.println("Sources: " + String.join(", ", report.sources()));
            for (Diagnostic diagnostic : report.diagnostics()) {
                out.println(diagnostic);
            }
            out.printf("%d fatal, %d warning(s)%n", report.fatalCount(), report.warningCount());
        }
        out.flush();
        return report.hasFatal() ? 1 : 0;
    }
}
