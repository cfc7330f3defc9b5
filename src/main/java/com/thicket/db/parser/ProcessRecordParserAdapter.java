package com.thicket.db.parser;

import com.thicket.db.model.ExtractorVersion;
import com.thicket.db.model.ParsedModel;
import lombok.Builder;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Extracts each asset in its own worker process.
 *
 * The worker's standard output is captured to a temporary file and decoded only after the
 * process has exited; standard error is passed through to this process.
 */
public class ProcessRecordParserAdapter implements RecordParserAdapter {
    private static final Logger log = LoggerFactory.getLogger(ProcessRecordParserAdapter.class);

    private final WorkerCommandFactory commandFactory;
    private final ExtractorVersion extractorVersion;
    private final Duration timeout;
    private final ParsedModelCodec codec = new ParsedModelCodec();

    /**
     * @param timeout per-worker limit; null or zero waits for as long as the worker runs
     */
    @Builder
    public ProcessRecordParserAdapter(@NonNull WorkerCommandFactory commandFactory,
                                      ExtractorVersion extractorVersion,
                                      Duration timeout) {
        this.commandFactory = commandFactory;
        this.extractorVersion = extractorVersion == null ? ExtractorVersion.UNKNOWN : extractorVersion;
        this.timeout = timeout;
    }

    @Override
    public ExtractorVersion extractorVersion() {
        return extractorVersion;
    }

    @Override
    public ParsedModel parse(Path assetFile) throws RecordParseException {
        List<String> command = commandFactory.command(assetFile);
        Path output = null;
        try {
            output = Files.createTempFile("thicket-worker-", ".json");

            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectOutput(output.toFile());
            pb.redirectError(ProcessBuilder.Redirect.INHERIT);

            log.debug("Starting worker: {}", String.join(" ", command));
            Process process = pb.start();
            int exit = await(process, assetFile);

            String captured = Files.readString(output, StandardCharsets.UTF_8);
            if (exit != 0) {
                throw new RecordParseException(assetFile, "worker exited with status " + exit);
            }
            return codec.decode(captured, assetFile);

        } catch (IOException e) {
            throw new RecordParseException(assetFile, "failed to run worker: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RecordParseException(assetFile, "interrupted while waiting for worker", e);
        } finally {
            deleteQuietly(output);
        }
    }

    private int await(Process process, Path assetFile) throws InterruptedException, RecordParseException {
        try {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                return process.waitFor();
            }
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new RecordParseException(assetFile, "worker timed out after " + timeout.toSeconds() + "s");
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete worker output {}: {}", file, e.getMessage());
        }
    }
}
