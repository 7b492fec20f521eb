package com.cfamily.astexport.cli.output;

import com.cfamily.astexport.cli.model.ExportOptions;
import com.cfamily.astexport.cli.model.ValidatedExportOptions;
import com.cfamily.astexport.export.ExportResult;
import com.cfamily.astexport.index.IdentityIndex;
import com.cfamily.astexport.index.KindHistogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Responsible only for printing CLI output for the "export" and "index" commands.
 * No validation, no execution.
 */
public class ExportResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ExportResultsPrinter.class);

    public void printBanner(ExportOptions o, ValidatedExportOptions v) {
        log.info("=================================================");
        log.info("C-family AST Exporter");
        log.info("=================================================");
        log.info("Sources: {}", v.getOutputsBySource().size());
        log.info("Format: {}{}", v.getExporterOptions().getFormat(), o.isPretty() ? " (pretty)" : "");
        log.info("Identities: {}", o.isAnonymize() ? "anonymized" : "raw addresses");
        log.info("Base Path: {}", o.getBasePath() != null ? o.getBasePath().toAbsolutePath() : "None");
        log.info("Header Deduplication: {}", o.isDedup() ? "on" : "off");
        log.info("=================================================");
    }

    public void printSuccess(ExportResult result) {
        log.info("Exported {} -> {}", result.getSource(), result.getOutputPath());
        log.info("  Declarations: {}", result.getDeclarations());
        log.info("  Statements: {}", result.getStatements());
        log.info("  Types: {}", result.getTypes());
        if (result.getComments() > 0) {
            log.info("  Comments: {}", result.getComments());
        }
        log.info("  Sentinels: {}", result.getSentinels());
        if (result.getSkippedDeclarations() > 0) {
            log.info("  Skipped (already exported): {}", result.getSkippedDeclarations());
        }
        if (result.getDanglingTypeReferences() > 0) {
            log.warn("  Dangling type references: {}", result.getDanglingTypeReferences());
        }
    }

    public void printFailure(ExportResult result) {
        log.error("Export of {} failed: {}", result.getSource(), result.getErrorMessage());
    }

    public void printSummary(List<ExportResult> results) {
        long failed = results.stream().filter(r -> !r.isSuccess()).count();

        log.info("");
        log.info("=================================================");
        log.info(failed == 0 ? "EXPORT SUCCESSFUL" : "EXPORT FINISHED WITH ERRORS");
        log.info("=================================================");
        log.info("Units Exported: {}", results.size() - failed);
        if (failed > 0) {
            log.info("Units Failed: {}", failed);
        }
        log.info("=================================================");
    }

    public void printIndex(Path source, IdentityIndex index, KindHistogram histogram) {
        log.info("=================================================");
        log.info("Identity index of {}", source);
        log.info("=================================================");
        log.info("Declarations: {}", index.getDeclarations().size());
        log.info("Statements: {}", index.getStatements().size());
        log.info("Types: {}", index.getTypes().size());
        log.info("");
        log.info("Nodes per kind:");
        for (Map.Entry<String, Integer> entry : histogram.asMap().entrySet()) {
            log.info("  {}: {}", entry.getKey(), entry.getValue());
        }
        log.info("=================================================");
    }
}
