package com.thicket.db.parser;

import com.thicket.db.TestModels;
import com.thicket.db.model.ExtractorVersion;
import com.thicket.db.model.ParsedModel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Uses small shell commands as stand-in workers.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessRecordParserAdapterTest {

    @TempDir
    Path tempDir;

    @Test
    void testDecodesCapturedStdout() throws Exception {
        Path asset = tempDir.resolve("Acer.lbw.gz");
        Files.writeString(asset, new ParsedModelCodec().encode(TestModels.parsed("Acer", "small")));

        ProcessRecordParserAdapter adapter = ProcessRecordParserAdapter.builder()
                .commandFactory(file -> List.of("cat", file.toString()))
                .extractorVersion(new ExtractorVersion(1, 0, 23))
                .build();

        ParsedModel parsed = adapter.parse(asset);

        assertThat(parsed.getModel().getName()).isEqualTo("Acer");
        assertThat(adapter.extractorVersion()).isEqualTo(new ExtractorVersion(1, 0, 23));
    }

    @Test
    void testEmptyOutputFails() {
        ProcessRecordParserAdapter adapter = ProcessRecordParserAdapter.builder()
                .commandFactory(file -> List.of("true"))
                .build();

        assertThatThrownBy(() -> adapter.parse(tempDir.resolve("x.lbw")))
                .isInstanceOf(RecordParseException.class)
                .hasMessageContaining("no output");
        assertThat(adapter.extractorVersion()).isEqualTo(ExtractorVersion.UNKNOWN);
    }

    @Test
    void testNonZeroExitFails() throws Exception {
        Path asset = tempDir.resolve("Acer.lbw.gz");
        Files.writeString(asset, new ParsedModelCodec().encode(TestModels.parsed("Acer", "small")));

        ProcessRecordParserAdapter adapter = ProcessRecordParserAdapter.builder()
                .commandFactory(file -> List.of("sh", "-c", "cat \"$0\"; exit 3", file.toString()))
                .build();

        assertThatThrownBy(() -> adapter.parse(asset))
                .isInstanceOf(RecordParseException.class)
                .hasMessageContaining("status 3");
    }

    @Test
    void testMissingExecutableFails() {
        ProcessRecordParserAdapter adapter = ProcessRecordParserAdapter.builder()
                .commandFactory(file -> List.of(tempDir.resolve("no-such-worker").toString()))
                .build();

        assertThatThrownBy(() -> adapter.parse(tempDir.resolve("x.lbw")))
                .isInstanceOf(RecordParseException.class)
                .hasMessageContaining("failed to run worker");
    }

    @Test
    void testTimeoutKillsWorker() {
        ProcessRecordParserAdapter adapter = ProcessRecordParserAdapter.builder()
                .commandFactory(file -> List.of("sleep", "30"))
                .timeout(Duration.ofMillis(200))
                .build();

        long started = System.currentTimeMillis();
        assertThatThrownBy(() -> adapter.parse(tempDir.resolve("x.lbw")))
                .isInstanceOf(RecordParseException.class)
                .hasMessageContaining("timed out");
        assertThat(System.currentTimeMillis() - started).isLessThan(10_000);
    }

    @Test
    void testJavaWorkerCommandLine() {
        JavaWorkerCommand command = JavaWorkerCommand.builder()
                .sdkPath(Path.of("/opt/sdk"))
                .logLevel("DEBUG")
                .javaExecutable("java")
                .classPath("app.jar")
                .build();

        assertThat(command.command(Path.of("/plants/Acer/Acer.lbw.gz"))).containsExactly(
                "java", "-cp", "app.jar", "com.thicket.db.ThicketDbApplication", "parse-model",
                "-f", "/plants/Acer/Acer.lbw.gz", "-s", "/opt/sdk", "-l", "DEBUG");
    }
}
