package io.batchrun.server.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.batchrun.core.command.JobCatalog;
import io.batchrun.core.queue.RunQueue;
import io.batchrun.serialization.definitions.Definitions;
import io.batchrun.serialization.definitions.DefinitionsLoader;
import io.batchrun.serialization.definitions.LoadSummary;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/// Loads commands, retention policies, jobs and scheduled jobs from a JSON file.
///
/// Definitions are upserted by name, so loading the same file twice changes nothing.
/// Every saved scheduled job gets its queue window regenerated.
///
/// ### Usage
/// ```
/// batchrun load-definitions jobs.json
/// ```
@Command(name = "load-definitions", description = "Load job definitions from a JSON file")
public class LoadDefinitionsCommand extends BatchrunCommand {

    @Parameters(index = "0", paramLabel = "FILE", description = "Definitions JSON file")
    Path file;

    @Inject ObjectMapper objectMapper;

    @Inject JobCatalog catalog;

    @Inject RunQueue runQueue;

    @Override
    protected int execute() {
        if (!Files.isRegularFile(file)) {
            System.err.println("Not a file: " + file);
            return EXIT_FAILURE;
        }
        Definitions definitions;
        try {
            definitions = objectMapper.readValue(file.toFile(), Definitions.class);
        } catch (IOException e) {
            System.err.println("Failed to read " + file + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
        LoadSummary summary = new DefinitionsLoader(catalog, runQueue).load(definitions);
        System.out.println("Loaded " + summary);
        return EXIT_OK;
    }
}
