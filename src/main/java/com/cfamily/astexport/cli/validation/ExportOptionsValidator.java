package com.cfamily.astexport.cli.validation;

import com.cfamily.astexport.cli.exception.OptionsValidationException;
import com.cfamily.astexport.cli.model.ExportOptions;
import com.cfamily.astexport.cli.model.ValidatedExportOptions;
import com.cfamily.astexport.export.ExporterOptions;
import com.cfamily.astexport.export.FileDeduplicator;
import com.cfamily.astexport.export.IdentityTable;
import com.cfamily.astexport.export.PathNormalizer;
import com.cfamily.astexport.frontend.FrontEnd;
import com.cfamily.astexport.frontend.FrontEndRegistry;
import com.cfamily.astexport.writer.OutputFormat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class ExportOptionsValidator {

	private final FrontEndRegistry frontEnds;

	public ExportOptionsValidator(FrontEndRegistry frontEnds) {
		this.frontEnds = frontEnds;
	}

	public ValidatedExportOptions validate(ExportOptions o) {
		List<String> errors = new ArrayList<>();

		List<Path> sources = o.getSources() == null ? List.of() : o.getSources();
		if (sources.isEmpty()) {
			errors.add("At least one source file is required.");
		}
		for (Path source : sources) {
			if (!Files.isRegularFile(source)) {
				errors.add("Source file does not exist or is not a file: " + source);
			}
		}

		if (o.getOutput() != null && o.getOutputDir() != null) {
			errors.add("--output and --output-dir are mutually exclusive.");
		}
		if (o.getOutput() != null && sources.size() > 1) {
			errors.add("--output accepts a single source; use --output-dir for " + sources.size() + " sources.");
		}
		if (o.getOutputDir() != null && Files.exists(o.getOutputDir()) && !Files.isDirectory(o.getOutputDir())) {
			errors.add("Output directory is not a directory: " + o.getOutputDir());
		}
		if (o.getBasePath() != null && !existsDirectory(o.getBasePath())) {
			errors.add("Base path does not exist or is not a directory: " + o.getBasePath());
		}

		OutputFormat format = o.getFormat() == null ? OutputFormat.JSON : o.getFormat();

		Map<Path, Path> outputs = new LinkedHashMap<>();
		Set<Path> seenOutputs = new HashSet<>();
		for (Path source : sources) {
			Path output = resolveOutput(o, source, format);
			if (!seenOutputs.add(output)) {
				errors.add("Two sources would be written to the same output: " + output);
			}
			if (Files.exists(output) && !o.isForce()) {
				errors.add("Output file already exists: " + output + ". Use --force to overwrite.");
			}
			outputs.put(source, output);
		}

		Map<Path, FrontEnd> selected = new LinkedHashMap<>();
		if (frontEnds.isEmpty()) {
			errors.add("No front end is available on the class path.");
		} else if (!isBlank(o.getFrontEnd()) && frontEnds.byName(o.getFrontEnd()).isEmpty()) {
			errors.add("Unknown front end: " + o.getFrontEnd());
		} else {
			for (Path source : sources) {
				Optional<FrontEnd> frontEnd = frontEnds.select(o.getFrontEnd(), source);
				if (frontEnd.isEmpty()) {
					errors.add("No front end supports source: " + source);
				} else {
					selected.put(source, frontEnd.get());
				}
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		ExporterOptions exporterOptions = ExporterOptions.builder()
				.format(format)
				.prettyPrint(o.isPretty())
				.emitRawIdentities(!o.isAnonymize())
				.identityTable(o.isAnonymize() ? new IdentityTable() : null)
				.deduplicator(o.isDedup() ? new FileDeduplicator() : null)
				.pathNormalizer(o.getBasePath() == null ? PathNormalizer.identity()
						: PathNormalizer.relativeTo(o.getBasePath()))
				.build();

		return new ValidatedExportOptions(outputs, selected, exporterOptions);
	}

	private static Path resolveOutput(ExportOptions o, Path source, OutputFormat format) {
		if (o.getOutput() != null) {
			return o.getOutput().toAbsolutePath().normalize();
		}
		String fileName = source.getFileName() + "." + format.getFileExtension();
		Path dir = o.getOutputDir() != null ? o.getOutputDir() : source.toAbsolutePath().getParent();
		return dir.resolve(fileName).toAbsolutePath().normalize();
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
