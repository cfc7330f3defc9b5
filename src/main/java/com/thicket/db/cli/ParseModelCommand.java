package com.thicket.db.cli;

import com.thicket.db.cli.model.ParseModelOptions;
import com.thicket.db.model.ParsedModel;
import com.thicket.db.parser.ModelRecordParser;
import com.thicket.db.parser.ParsedModelCodec;
import com.thicket.db.sdk.PlantSdk;
import com.thicket.db.sdk.PlantSdkLoader;
import com.thicket.db.util.LogLevels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Worker entry point: extracts one asset and prints its record JSON on standard output.
 * Nothing else may be written to standard output.
 */
@Command(
        name = "parse-model",
        mixinStandardHelpOptions = true,
        description = "Read a model file and print the model record JSON."
)
public class ParseModelCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseModelCommand.class);

    @Mixin
    private ParseModelOptions options;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        LogLevels.setRootLevel(options.getLogLevel().getLogbackLevel());
        try {
            PlantSdk sdk = new PlantSdkLoader().load(options.getSdkPath());
            ParsedModel parsed = new ModelRecordParser(sdk).parse(options.getFile());

            PrintWriter out = spec.commandLine().getOut();
            out.println(new ParsedModelCodec().encode(parsed));
            out.flush();
            return 0;
        } catch (IOException e) {
            log.error("Failed to parse {}: {}", options.getFile(), e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            log.error("Extractor failed on {}", options.getFile(), e);
            return 1;
        }
    }
}
