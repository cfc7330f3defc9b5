package com.thicket.db.cli;

import com.thicket.db.build.BuildConfig;
import com.thicket.db.build.BuildResult;
import com.thicket.db.build.BuildScheduler;
import com.thicket.db.cli.exception.OptionsValidationException;
import com.thicket.db.cli.model.BuildOptions;
import com.thicket.db.cli.output.BuildResultsPrinter;
import com.thicket.db.cli.validation.BuildOptionsValidator;
import com.thicket.db.database.ModelDatabase;
import com.thicket.db.model.ExtractorVersion;
import com.thicket.db.parser.JavaWorkerCommand;
import com.thicket.db.parser.ProcessRecordParserAdapter;
import com.thicket.db.parser.RecordParserAdapter;
import com.thicket.db.sdk.PlantSdkLoader;
import com.thicket.db.util.LogLevels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * Rebuilds the database from a plant models directory, extracting each asset in a worker process.
 */
@Command(
        name = "build",
        mixinStandardHelpOptions = true,
        description = "Scan the models path and add all models to a new database."
)
public class BuildCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    @Mixin
    private BuildOptions options;

    @Override
    public Integer call() {
        LogLevels.setRootLevel(options.getLogLevel().getLogbackLevel());
        BuildResultsPrinter printer = new BuildResultsPrinter();
        try {
            BuildConfig config = new BuildOptionsValidator().validate(options);
            printer.printBanner(config);

            // Loaded here only for its version; extraction itself happens in the workers.
            ExtractorVersion version = new PlantSdkLoader().load(config.getSdkPath()).version();

            RecordParserAdapter adapter = ProcessRecordParserAdapter.builder()
                    .commandFactory(JavaWorkerCommand.builder()
                            .sdkPath(config.getSdkPath())
                            .logLevel(config.getLogLevel())
                            .build())
                    .extractorVersion(version)
                    .timeout(config.getJobTimeout())
                    .build();

            ModelDatabase db = ModelDatabase.create(config.getDatabasePath(), config.getLocale(), version);
            BuildResult result = new BuildScheduler(db, adapter, config.getJobs()).build(config.getAssetsDir());

            printer.printSummary(result);
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (IOException e) {
            log.error("Build failed: {}", e.getMessage(), e);
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Build interrupted");
            return 1;
        }
    }
}
