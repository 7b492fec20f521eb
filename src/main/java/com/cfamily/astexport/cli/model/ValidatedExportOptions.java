package com.cfamily.astexport.cli.model;

import com.cfamily.astexport.export.ExporterOptions;
import com.cfamily.astexport.frontend.FrontEnd;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;
import java.util.Map;

/**
 * Derived values needed by the executor. Keeps ExportCommand thin.
 * Both maps are keyed by source, in command line order.
 */
@Data
@AllArgsConstructor
public class ValidatedExportOptions {
	Map<Path, Path> outputsBySource;
	Map<Path, FrontEnd> frontEndsBySource;
	ExporterOptions exporterOptions;
}
