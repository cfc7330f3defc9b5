package com.thicket.db.cli;

import com.thicket.db.cli.model.ReadOptions;
import com.thicket.db.cli.output.DatabaseSummaryPrinter;
import com.thicket.db.database.CorruptDatabaseException;
import com.thicket.db.database.DatabaseNotFoundException;
import com.thicket.db.database.ModelDatabase;
import com.thicket.db.database.StaleSchemaException;
import com.thicket.db.util.LogLevels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.util.concurrent.Callable;

@Command(
        name = "read",
        mixinStandardHelpOptions = true,
        description = "Read and print the database contents."
)
public class ReadCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReadCommand.class);

    @Mixin
    private ReadOptions options;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        LogLevels.setRootLevel(options.getLogLevel().getLogbackLevel());
        try {
            ModelDatabase db = ModelDatabase.open(options.getDatabase(), options.getLocale(), false);
            new DatabaseSummaryPrinter().print(db, spec.commandLine().getOut());
            return 0;
        } catch (DatabaseNotFoundException e) {
            log.error("Database not found: {}", e.getPath());
            return 1;
        } catch (StaleSchemaException | CorruptDatabaseException e) {
            log.error("{}. Rebuild it with the build command.", e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Failed to read database {}", options.getDatabase(), e);
            return 1;
        }
    }
}
