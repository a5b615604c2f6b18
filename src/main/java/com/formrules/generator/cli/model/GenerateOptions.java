package com.formrules.generator.cli.model;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--input", "-i" }, required = true, description = "JSON form definition document")
	private Path inputFile;

	@Option(names = { "--output-dir", "-o" }, description = "Output directory (defaults to current directory)")
	private Path outputDir;

	@Option(names = { "--force", "-f" }, description = "Overwrite existing form output directories")
	private boolean force;

	@Option(names = { "--dry-run" }, description = "Run the whole pipeline and report, but write no files")
	private boolean dryRun;

	@Option(names = { "--nesting-override" }, paramLabel = "CHILD=PARENT",
			description = "Declare the parent group of a repeating group (repeatable)")
	private Map<String, String> nestingOverrides = new LinkedHashMap<>();

	@Option(names = {
			"--no-submit-message" }, description = "Do not show a confirmation message after a successful submit")
	private boolean noSubmitMessage;

}
