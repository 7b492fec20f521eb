package com.cfamily.astexport.cli.model;

import com.cfamily.astexport.writer.OutputFormat;
import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Holds all CLI options for the "export" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ExportOptions {

	@Parameters(arity = "1..*", paramLabel = "SOURCE", description = "Source files to parse and export")
	private List<Path> sources = new ArrayList<>();

	@Option(names = { "--output", "-o" }, description = "Output file (single source only)")
	private Path output;

	@Option(names = { "--output-dir",
			"-d" }, description = "Output directory; one document per source named <source>.<format>")
	private Path outputDir;

	@Option(names = { "--format",
			"-f" }, defaultValue = "JSON", description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
	private OutputFormat format;

	@Option(names = { "--pretty" }, description = "Pretty-print JSON output")
	private boolean pretty;

	@Option(names = { "--anonymize" }, description = "Replace node addresses with dense per-unit indexes")
	private boolean anonymize;

	@Option(names = { "--base-path" }, description = "Write source file names relative to this directory")
	private Path basePath;

	@Option(names = {
			"--dedup" }, description = "Skip declarations from headers already exported by an earlier source")
	private boolean dedup;

	@Option(names = { "--front-end" }, description = "Front end to use (default: first one supporting the source)")
	private String frontEnd;

	@Option(names = { "--force" }, description = "Overwrite existing output files")
	private boolean force;
}
