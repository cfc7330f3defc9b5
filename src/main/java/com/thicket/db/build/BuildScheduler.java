package com.thicket.db.build;

import com.thicket.db.database.ModelDatabase;
import com.thicket.db.model.ParsedModel;
import com.thicket.db.parser.RecordParseException;
import com.thicket.db.parser.RecordParserAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Rebuilds a {@link ModelDatabase} from a directory of assets.
 *
 * At most {@code jobs} extractions run at once. Results are collected strictly in launch
 * order, waiting on the oldest job even when younger ones have finished, and merged into
 * the database one at a time on the calling thread. A failed asset is logged and left out.
 */
public class BuildScheduler {
    private static final Logger log = LoggerFactory.getLogger(BuildScheduler.class);

    static final int FALLBACK_JOBS = 4;

    private final ModelDatabase database;
    private final RecordParserAdapter adapter;
    private final AssetDiscoveryService discoveryService;
    private final int jobs;

    /**
     * @param jobs maximum parallel extractions; 0 or less picks one per available processor
     */
    public BuildScheduler(ModelDatabase database, RecordParserAdapter adapter,
                          AssetDiscoveryService discoveryService, int jobs) {
        this.database = database;
        this.adapter = adapter;
        this.discoveryService = discoveryService;
        this.jobs = resolveJobs(jobs, Runtime.getRuntime().availableProcessors());
    }

    public BuildScheduler(ModelDatabase database, RecordParserAdapter adapter, int jobs) {
        this(database, adapter, new AssetDiscoveryService(), jobs);
    }

    static int resolveJobs(int requested, int availableProcessors) {
        if (requested > 0) {
            return requested;
        }
        return availableProcessors > 0 ? availableProcessors : FALLBACK_JOBS;
    }

    public int getJobs() {
        return jobs;
    }

    /**
     * Replaces the database content with the models extracted from {@code assetsDir} and saves it.
     */
    public BuildResult build(Path assetsDir) throws IOException, InterruptedException {
        long started = System.currentTimeMillis();
        database.initialize(adapter.extractorVersion());

        List<Path> files = discoveryService.discoverAssetFiles(assetsDir);
        int total = files.size();
        log.info("Parsing {} models using {} parallel jobs", total, jobs);

        BuildResult.BuildResultBuilder result = BuildResult.builder().total(total).jobs(jobs);
        int succeeded = 0;

        Deque<Path> pending = new ArrayDeque<>(files);
        Deque<Job> inFlight = new ArrayDeque<>();
        ExecutorService pool = Executors.newFixedThreadPool(jobs, namedFactory("thicket-worker-"));
        try {
            while (!pending.isEmpty() || !inFlight.isEmpty()) {
                while (inFlight.size() < jobs && !pending.isEmpty()) {
                    Path file = pending.removeFirst();
                    log.debug("Parsing: {}", file);
                    inFlight.addLast(new Job(file, pool.submit(() -> adapter.parse(file))));
                }

                Job oldest = inFlight.removeFirst();
                ParsedModel parsed = collect(oldest);
                if (parsed == null) {
                    result.failedFile(oldest.file);
                    continue;
                }
                String name = parsed.getModel().getName();
                database.addModel(parsed);
                result.addedModel(name);
                succeeded++;
                log.info("Added \"{}\"", name);
            }
        } finally {
            shutdown(pool, inFlight);
        }

        if (!pending.isEmpty()) {
            log.error("Exited worker loop with {} model files remaining", pending.size());
        }
        if (!inFlight.isEmpty()) {
            log.error("Exited worker loop with {} jobs still running", inFlight.size());
        }

        database.save();
        log.info("Processed {}/{} models", succeeded, total);

        return result.succeeded(succeeded)
                .elapsedMillis(System.currentTimeMillis() - started)
                .build();
    }

    private ParsedModel collect(Job job) throws InterruptedException {
        try {
            return job.future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RecordParseException) {
                log.error("Failed to parse {}: {}", job.file, cause.getMessage());
            } else {
                log.error("Unexpected error while parsing {}", job.file, cause);
            }
            return null;
        }
    }

    private static void shutdown(ExecutorService pool, Deque<Job> inFlight) {
        for (Job job : inFlight) {
            job.future.cancel(true);
        }
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker threads did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedFactory(String prefix) {
        return new ThreadFactory() {
            private final ThreadFactory base = Executors.defaultThreadFactory();
            private final AtomicInteger seq = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = base.newThread(r);
                t.setName(prefix + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
    }

    private static final class Job {
        private final Path file;
        private final Future<ParsedModel> future;

        private Job(Path file, Future<ParsedModel> future) {
            this.file = file;
            this.future = future;
        }
    }
}
