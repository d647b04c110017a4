package com.cscript.compiler.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options of {@code cscriptc}. No validation, no execution
 * logic, no printing. Values given here are the starting configuration;
 * directives in the source override them.
 */
@Getter
public class CompileOptions {

	@Parameters(index = "0", paramLabel = "FILE", description = "C-Script source file (.csc)")
	private Path source;

	@Option(names = { "--output", "-o" }, description = "Executable to produce (default: <input>.out)")
	private Path output;

	@Option(names = { "--opt", "-O" }, description = "Optimization level: O0, O1, O2, O3, max or size")
	private String opt;

	@Option(names = { "--profile" }, description = "Profile-guided build: on, off or auto")
	private String profile;

	@Option(names = { "--no-lto" }, description = "Disable link-time optimization")
	private boolean noLto;

	@Option(names = { "--strict" }, description = "Keep hardline checks on even if the source turns them off")
	private boolean strict;

	@Option(names = { "--show-c" }, description = "Print the generated C to stdout instead of building")
	private boolean showC;

	@Option(names = { "--cc" }, description = "C compiler to use (default: first of cc, clang, gcc found)")
	private String compiler;

	@Option(names = { "--debug", "-g" }, description = "Build with debug information")
	private boolean debug;

	@Option(names = {
			"--profile-timeout-ms" }, defaultValue = "30000", description = "Time limit for the instrumented run in milliseconds")
	private long profileTimeoutMs;

	@Option(names = {
			"--hot-limit" }, defaultValue = "16", description = "Maximum number of functions marked hot after profiling")
	private int hotLimit;

	@Option(names = { "--temp-dir" }, description = "Parent directory for intermediate files")
	private Path tempDir;

	@Option(names = { "--verbose", "-v" }, description = "Enable debug logging")
	private boolean verbose;
}
