package com.thicket.db.build;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a full rebuild.
 */
@Value
@Builder
public class BuildResult {

    int succeeded;
    int total;
    int jobs;

    /** Model names in the order they were merged. */
    @Singular
    List<String> addedModels;

    @Singular
    List<Path> failedFiles;

    long elapsedMillis;

    public int getFailed() {
        return total - succeeded;
    }
}
