package org.ascenoria.cli.commands;

import org.ascenoria.cli.CommandLineInterface;
import org.ascenoria.config.ContentSettings;
import org.ascenoria.content.api.ContentLoadException;
import org.ascenoria.runtime.ContentRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Loads the content and keeps it current with hot reloading until interrupted."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() {
        final ContentRuntime runtime = new ContentRuntime(ContentSettings.fromConfig(parent.getConfig()));
        try {
            runtime.start();
        } catch (ContentLoadException e) {
            return 1;
        }

        // Keep the main thread alive; the runtime's shutdown hook stops hot reloading.
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            runtime.stop();
            LOGGER.info("Content runtime stopped.");
        }
        return 0;
    }
}
