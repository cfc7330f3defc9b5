package com.thicket.db;

import com.thicket.db.cli.ThicketDbCommand;
import picocli.CommandLine;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Main entry point for the Thicket plant database tool.
 * Reads, builds and (as a build worker) extracts single assets for the plant model database.
 */
public class ThicketDbApplication {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String... args) {
        return new CommandLine(new ThicketDbCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                // workers answer on stdout; the coordinator decodes it as UTF-8
                .setOut(new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true))
                .execute(args);
    }
}
