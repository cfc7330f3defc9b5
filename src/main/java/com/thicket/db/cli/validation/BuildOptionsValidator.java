package com.thicket.db.cli.validation;

import com.thicket.db.build.BuildConfig;
import com.thicket.db.cli.exception.OptionsValidationException;
import com.thicket.db.cli.model.BuildOptions;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class BuildOptionsValidator {

	public BuildConfig validate(BuildOptions o) {
		List<String> errors = new ArrayList<>();

		if (!existsDirectory(o.getModelsPath())) {
			errors.add("Plant models directory does not exist or is not a directory: " + o.getModelsPath());
		}
		if (!existsDirectory(o.getSdkPath())) {
			errors.add("SDK directory does not exist or is not a directory: " + o.getSdkPath());
		}

		Path database = o.getDatabase() == null ? null : o.getDatabase().toAbsolutePath().normalize();
		if (database != null && Files.isDirectory(database)) {
			errors.add("Database path is a directory: " + database);
		}

		if (o.getJobs() < 0) {
			errors.add("Jobs must be >= 0. Got: " + o.getJobs());
		}
		if (o.getJobTimeoutSeconds() < 0) {
			errors.add("Job timeout must be >= 0. Got: " + o.getJobTimeoutSeconds());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return BuildConfig.builder()
				.databasePath(database)
				.assetsDir(o.getModelsPath().toAbsolutePath().normalize())
				.sdkPath(o.getSdkPath().toAbsolutePath().normalize())
				.locale(o.getLocale())
				.logLevel(o.getLogLevel() == null ? null : o.getLogLevel().name())
				.jobs(o.getJobs())
				.jobTimeout(Duration.ofSeconds(o.getJobTimeoutSeconds()))
				.build();
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}
}
