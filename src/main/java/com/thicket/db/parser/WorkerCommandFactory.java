package com.thicket.db.parser;

import java.nio.file.Path;
import java.util.List;

/**
 * Builds the command line of the worker process that extracts one asset.
 */
@FunctionalInterface
public interface WorkerCommandFactory {

    List<String> command(Path assetFile);
}
