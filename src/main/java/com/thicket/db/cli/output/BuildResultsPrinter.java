package com.thicket.db.cli.output;

import com.thicket.db.build.BuildConfig;
import com.thicket.db.build.BuildResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Responsible only for logging the banner and summary of the "build" command.
 */
public class BuildResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(BuildResultsPrinter.class);

    public void printBanner(BuildConfig config) {
        log.info("=================================================");
        log.info("Thicket Database Build");
        log.info("=================================================");
        log.info("Database: {}", config.getDatabasePath());
        log.info("Models Directory: {}", config.getAssetsDir());
        log.info("SDK Directory: {}", config.getSdkPath());
        log.info("Jobs: {}", config.getJobs() > 0 ? config.getJobs() : "auto");
        log.info("Job Timeout: {}", config.getJobTimeout() == null || config.getJobTimeout().isZero()
                ? "none" : config.getJobTimeout().toSeconds() + "s");
        log.info("=================================================");
    }

    public void printSummary(BuildResult result) {
        log.info("");
        log.info("=================================================");
        log.info("BUILD {}", result.getFailed() == 0 ? "SUCCESSFUL" : "COMPLETED WITH FAILURES");
        log.info("=================================================");
        log.info("Models Added: {}/{}", result.getSucceeded(), result.getTotal());
        log.info("Parallel Jobs: {}", result.getJobs());
        log.info("Elapsed: {} ms", result.getElapsedMillis());
        if (!result.getFailedFiles().isEmpty()) {
            log.warn("Failed Assets:");
            for (Path file : result.getFailedFiles()) {
                log.warn("  {}", file);
            }
        }
        log.info("=================================================");
    }
}
