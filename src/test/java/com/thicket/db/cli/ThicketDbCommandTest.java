package com.thicket.db.cli;

import com.thicket.db.TestModels;
import com.thicket.db.database.ModelDatabase;
import com.thicket.db.model.ExtractorVersion;
import com.thicket.db.model.ParsedModel;
import com.thicket.db.parser.ParsedModelCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ThicketDbCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new ThicketDbCommand()).setCaseInsensitiveEnumValuesAllowed(true);
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void testNoCommandPrintsUsage() {
        assertThat(run()).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("read", "build", "parse-model");
    }

    @Test
    void testMissingRequiredOptionsPrintUsage() {
        assertThat(run("read")).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("-d");

        assertThat(run("build", "-d", "db.json", "-p", "plants")).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(run("parse-model")).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    void testReadMissingDatabaseFails() {
        assertThat(run("read", "-d", tempDir.resolve("missing.json").toString())).isEqualTo(1);
    }

    @Test
    void testReadPrintsSummary() throws IOException {
        Path dbPath = tempDir.resolve("thicket.json");
        ModelDatabase db = ModelDatabase.create(dbPath, "en", new ExtractorVersion(1, 0, 23));
        db.addModel(TestModels.parsed("Betula", "young"));
        db.addModel(TestModels.parsed("Acer", "small", "large"));
        db.save();

        int exit = run("read", "-d", dbPath.toString(), "--locale", "de_DE", "-l", "error");

        assertThat(exit).isZero();
        String printed = out.toString();
        assertThat(printed).contains("SDK Version: 1.0.23", "Loaded 2 models:", "Acer (Acer (de))",
                "default_variant: small", "[spring, summer]");
        assertThat(printed.indexOf("Acer (")).isLessThan(printed.indexOf("Betula ("));
    }

    @Test
    void testReadStaleDatabaseFails() throws IOException {
        Path dbPath = tempDir.resolve("old.json");
        Files.writeString(dbPath, "{\"info\": {\"schema_version\": 1}, \"labels\": {}, \"models\": {}}");

        assertThat(run("read", "-d", dbPath.toString())).isEqualTo(1);
    }

    @Test
    void testParseModelPrintsRecordJson() throws Exception {
        Path asset = Files.createDirectories(tempDir.resolve("Acer")).resolve("Acer.lbw.gz");
        Files.writeString(asset, "plant");

        int exit = run("parse-model", "-f", asset.toString(), "-l", "ERROR");

        assertThat(exit).isZero();
        ParsedModel parsed = new ParsedModelCodec().decode(out.toString(), asset);
        assertThat(parsed.getModel().getName()).isEqualTo("Acer");
        assertThat(parsed.getModel().getDefaultVariant()).isEqualTo("large");
    }

    @Test
    void testParseModelFailureWritesNothing() throws IOException {
        Path asset = Files.createDirectories(tempDir.resolve("Acer")).resolve("Acer.lbw.gz");
        Files.writeString(asset, "broken");

        assertThat(run("parse-model", "-f", asset.toString(), "-l", "CRITICAL")).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testBuildRejectsInvalidPaths() {
        int exit = run("build",
                "-d", tempDir.resolve("db.json").toString(),
                "-p", tempDir.resolve("no-plants").toString(),
                "-s", tempDir.resolve("no-sdk").toString(),
                "-l", "critical");

        assertThat(exit).isEqualTo(1);
        assertThat(Files.exists(tempDir.resolve("db.json"))).isFalse();
    }
}
