package com.localization.resources.cli.model;

import java.nio.file.Path;

import com.localization.resources.model.ResourceTableConfig;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "lint" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class LintOptions {

	@Option(names = { "--resource-dir", "-d" }, required = true, description = "Directory containing .properties resource bundles")
	private Path resourceDir;

	@Option(names = { "--base-name", "-b" }, description = "Only check the bundle with this base name")
	private String baseName;

	@Option(names = {
			"--invariant-marker" }, defaultValue = ResourceTableConfig.DEFAULT_INVARIANT_MARKER, description = "Comment token marking entries that need no translation (default: @Invariant)")
	private String invariantMarker;

	@Option(names = {
			"--fail-on-mismatch" }, description = "Exit with code 1 if any format parameter mismatch is found")
	private boolean failOnMismatch;

	@Option(names = { "--quiet", "-q" }, description = "Print the summary only, not every finding")
	private boolean quiet;

	// ---- Getters (no setters needed; picocli sets fields reflectively) ----

}
