package com.thicket.db.build;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings for one {@code build} run.
 */
@Data
@Builder
public class BuildConfig {
    private Path databasePath;
    private Path assetsDir;
    private Path sdkPath;
    private String locale;
    private String logLevel;

    /** Parallel workers; 0 means one per available processor. */
    private int jobs;

    /** Per-worker limit; null or zero waits indefinitely. */
    private Duration jobTimeout;
}
