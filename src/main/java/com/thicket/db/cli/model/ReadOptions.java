package com.thicket.db.cli.model;

import com.thicket.db.database.ModelDatabase;
import lombok.Getter;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options of the "read" command.
 */
@Getter
public class ReadOptions {

    @Option(names = { "-d", "--database" }, required = true, description = "Database filename")
    private Path database;

    @Option(names = { "--locale" }, defaultValue = ModelDatabase.DEFAULT_LOCALE,
            description = "Locale for labels (default: ${DEFAULT-VALUE})")
    private String locale;

    @Option(names = { "-l", "--log-level" }, defaultValue = "INFO",
            description = "Logger level: ${COMPLETION-CANDIDATES}")
    private LogLevel logLevel;
}
