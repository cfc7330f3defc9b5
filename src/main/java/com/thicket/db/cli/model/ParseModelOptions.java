package com.thicket.db.cli.model;

import lombok.Getter;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options of the "parse-model" worker command.
 */
@Getter
public class ParseModelOptions {

    @Option(names = { "-f", "--file" }, required = true, description = "Plant model filename (.lbw or .lbw.gz)")
    private Path file;

    @Option(names = { "-s", "--sdk-path" }, description = "Plant SDK directory (default: class path)")
    private Path sdkPath;

    @Option(names = { "-l", "--log-level" }, defaultValue = "INFO",
            description = "Logger level: ${COMPLETION-CANDIDATES}")
    private LogLevel logLevel;
}
