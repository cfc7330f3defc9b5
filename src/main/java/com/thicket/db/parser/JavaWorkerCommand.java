package com.thicket.db.parser;

import com.thicket.db.ThicketDbApplication;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs {@code parse-model} in a fresh JVM with this application's class path.
 */
@Value
@Builder
public class JavaWorkerCommand implements WorkerCommandFactory {
    Path sdkPath;
    String logLevel;

    @Builder.Default
    String javaExecutable = Path.of(System.getProperty("java.home"), "bin", "java").toString();

    @Builder.Default
    String classPath = System.getProperty("java.class.path");

    @Override
    public List<String> command(Path assetFile) {
        List<String> command = new ArrayList<>();
        command.add(javaExecutable);
        command.add("-cp");
        command.add(classPath);
        command.add(ThicketDbApplication.class.getName());
        command.add("parse-model");
        command.add("-f");
        command.add(assetFile.toString());
        if (sdkPath != null) {
            command.add("-s");
            command.add(sdkPath.toString());
        }
        if (logLevel != null) {
            command.add("-l");
            command.add(logLevel);
        }
        return command;
    }
}
