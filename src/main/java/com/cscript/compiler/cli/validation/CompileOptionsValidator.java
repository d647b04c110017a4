package com.cscript.compiler.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.cscript.compiler.build.OrchestratorSettings;
import com.cscript.compiler.cli.exception.OptionsValidationException;
import com.cscript.compiler.cli.model.CompileOptions;
import com.cscript.compiler.cli.model.ValidatedCompileOptions;
import com.cscript.compiler.model.Configuration;
import com.cscript.compiler.model.OptLevel;
import com.cscript.compiler.model.ProfileMode;

public class CompileOptionsValidator {

	static final String SOURCE_EXTENSION = ".csc";
	static final String OUTPUT_EXTENSION = ".out";

	public ValidatedCompileOptions validate(CompileOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getSource() == null) {
			errors.add("A source file is required.");
		} else if (!Files.isRegularFile(o.getSource())) {
			errors.add("Source file does not exist or is not a regular file: " + o.getSource());
		}

		Optional<OptLevel> opt = Optional.empty();
		if (o.getOpt() != null) {
			opt = OptLevel.fromDirective(o.getOpt());
			if (opt.isEmpty()) {
				errors.add("Optimization level must be one of O0, O1, O2, O3, max, size. Got: " + o.getOpt());
			}
		}

		Optional<ProfileMode> profile = Optional.empty();
		if (o.getProfile() != null) {
			profile = ProfileMode.fromDirective(o.getProfile());
			if (profile.isEmpty()) {
				errors.add("Profile mode must be one of on, off, auto. Got: " + o.getProfile());
			}
		}

		if (o.getProfileTimeoutMs() <= 0) {
			errors.add("Profile timeout must be > 0. Got: " + o.getProfileTimeoutMs());
		}
		if (o.getHotLimit() < 0) {
			errors.add("Hot function limit must be >= 0. Got: " + o.getHotLimit());
		}
		if (o.getTempDir() != null && Files.exists(o.getTempDir()) && !Files.isDirectory(o.getTempDir())) {
			errors.add("Temporary directory is not a directory: " + o.getTempDir());
		}
		if (o.getOutput() != null && Files.isDirectory(o.getOutput())) {
			errors.add("Output is a directory: " + o.getOutput());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		Configuration.ConfigurationBuilder base = Configuration.builder()
				.out(outputFor(o).toString())
				.lto(!o.isNoLto())
				.debug(o.isDebug());
		if (o.isStrict()) {
			base.hardline(true);
		}
		opt.ifPresent(base::opt);
		profile.ifPresent(base::profile);

		OrchestratorSettings.OrchestratorSettingsBuilder settings = OrchestratorSettings.builder()
				.profileTimeout(Duration.ofMillis(o.getProfileTimeoutMs()))
				.hotFunctionLimit(o.getHotLimit());
		if (o.getTempDir() != null) {
			settings.tempRoot(o.getTempDir().toAbsolutePath().normalize());
		}

		return new ValidatedCompileOptions(o.getSource(), base.build(), settings.build());
	}

	/**
	 * {@code dir/app.csc} builds {@code app.out} in the working directory unless
	 * {@code --output} says otherwise.
	 */
	static Path outputFor(CompileOptions o) {
		if (o.getOutput() != null) {
			return o.getOutput();
		}
		String name = o.getSource().getFileName().toString();
		if (name.endsWith(SOURCE_EXTENSION)) {
			name = name.substring(0, name.length() - SOURCE_EXTENSION.length());
		}
		return Path.of(name + OUTPUT_EXTENSION);
	}
}
