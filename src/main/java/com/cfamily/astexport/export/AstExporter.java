package com.cfamily.astexport.export;

import com.cfamily.astexport.exception.ExportConfigurationException;
import com.cfamily.astexport.model.decl.TranslationUnitDecl;
import com.cfamily.astexport.util.FileWriteUtil;
import com.cfamily.astexport.writer.AstWriter;
import com.cfamily.astexport.writer.AstWriterFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;

/**
 * Entry point of the export engine: writes one translation unit per call as a single
 * document in the configured format.
 * <p>
 * Options are validated once, on construction. Every call runs a fresh
 * {@link ExportSession}; the identity table and the file deduplicator in the options are
 * shared by all calls.
 */
public class AstExporter {

    private static final Logger log = LoggerFactory.getLogger(AstExporter.class);

    private final ExporterOptions options;
    private final AstWriterFactory writerFactory = new AstWriterFactory();

    public AstExporter(ExporterOptions options) {
        new ExporterOptionsValidator().validate(options);
        this.options = options;
    }

    public ExporterOptions getOptions() {
        return options;
    }

    /**
     * Exports {@code unit} to {@code output}, creating parent directories as needed.
     *
     * @throws ExportConfigurationException if the output cannot be opened; nothing is written
     * @throws IOException if writing fails midway
     */
    public ExportResult export(TranslationUnitDecl unit, Path output) throws IOException {
        OutputStream out;
        try {
            out = FileWriteUtil.openOutput(output);
        } catch (IOException e) {
            throw new ExportConfigurationException("Cannot open output " + output + ": " + e.getMessage(), e);
        }

        Path source = unit.getMainFile() == null ? null : Path.of(unit.getMainFile());
        try (OutputStream target = out) {
            ExportCounters counters = export(unit, target);
            log.info("Exported {} to {} ({} declarations, {} statements, {} types)",
                    unit.getMainFile(), output, counters.getDeclarations(), counters.getStatements(),
                    counters.getTypes());
            return ExportResult.success(source, output, counters);
        }
    }

    /**
     * Exports {@code unit} to {@code out}. The stream is flushed, not closed.
     */
    public ExportCounters export(TranslationUnitDecl unit, OutputStream out) throws IOException {
        if (unit == null) {
            throw new IllegalArgumentException("Translation unit is required");
        }
        try (AstWriter writer = writerFactory.create(out, options.getFormat(), options.isPrettyPrint())) {
            ExportSession session = new ExportSession(writer, options);
            ExportCounters counters = session.export(unit);

            if (counters.getDanglingTypeReferences() > 0) {
                log.warn("{} type references in {} point outside the unit's type list",
                        counters.getDanglingTypeReferences(), unit.getMainFile());
            }
            if (counters.getSkippedDeclarations() > 0) {
                log.debug("Skipped {} declarations already exported by another unit",
                        counters.getSkippedDeclarations());
            }
            return counters;
        }
    }
}
