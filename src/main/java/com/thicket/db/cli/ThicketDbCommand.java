package com.thicket.db.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Top-level command; prints usage when no subcommand is given.
 */
@Command(
        name = "thicket-db",
        mixinStandardHelpOptions = true,
        version = "thicket-db 1.0.0",
        description = "Thicket plant model database tool.",
        subcommands = {ReadCommand.class, BuildCommand.class, ParseModelCommand.class}
)
public class ThicketDbCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return CommandLine.ExitCode.USAGE;
    }
}
