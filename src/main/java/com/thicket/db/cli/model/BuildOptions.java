package com.thicket.db.cli.model;

import com.thicket.db.database.ModelDatabase;
import lombok.Getter;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options of the "build" command. No validation, no execution logic.
 */
@Getter
public class BuildOptions {

    @Option(names = { "-d", "--database" }, required = true, description = "Database filename")
    private Path database;

    @Option(names = { "-p", "--models-path" }, required = true, description = "Plant models directory")
    private Path modelsPath;

    @Option(names = { "-s", "--sdk-path" }, required = true, description = "Plant SDK directory")
    private Path sdkPath;

    @Option(names = { "-j", "--jobs" }, defaultValue = "0",
            description = "Parallel workers (default: one per processor)")
    private int jobs;

    @Option(names = { "--job-timeout" }, defaultValue = "0",
            description = "Seconds before a worker is killed (default: no limit)")
    private long jobTimeoutSeconds;

    @Option(names = { "--locale" }, defaultValue = ModelDatabase.DEFAULT_LOCALE,
            description = "Locale for labels (default: ${DEFAULT-VALUE})")
    private String locale;

    @Option(names = { "-l", "--log-level" }, defaultValue = "INFO",
            description = "Logger level: ${COMPLETION-CANDIDATES}")
    private LogLevel logLevel;
}
