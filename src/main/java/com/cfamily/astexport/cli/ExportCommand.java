package com.cfamily.astexport.cli;

import com.cfamily.astexport.cli.exception.OptionsValidationException;
import com.cfamily.astexport.cli.model.ExportOptions;
import com.cfamily.astexport.cli.model.ValidatedExportOptions;
import com.cfamily.astexport.cli.output.ExportResultsPrinter;
import com.cfamily.astexport.cli.validation.ExportOptionsValidator;
import com.cfamily.astexport.exception.ExportConfigurationException;
import com.cfamily.astexport.exception.SchemaException;
import com.cfamily.astexport.export.AstExporter;
import com.cfamily.astexport.export.ExportResult;
import com.cfamily.astexport.export.IdentityTable;
import com.cfamily.astexport.frontend.FrontEnd;
import com.cfamily.astexport.frontend.FrontEndRegistry;
import com.cfamily.astexport.model.decl.TranslationUnitDecl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Parses each source with a front end and writes one document per translation unit.
 */
@Command(
        name = "export",
        mixinStandardHelpOptions = true,
        version = "ast-exporter 1.0.0",
        description = "Exports the AST of each source file as an arity-declared JSON or CBOR document."
)
public class ExportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExportCommand.class);

    @Mixin
    private ExportOptions options;

    private final FrontEndRegistry frontEnds;
    private final ExportResultsPrinter printer = new ExportResultsPrinter();

    public ExportCommand() {
        this(FrontEndRegistry.load());
    }

    public ExportCommand(FrontEndRegistry frontEnds) {
        this.frontEnds = frontEnds;
    }

    @Override
    public Integer call() {
        ValidatedExportOptions validated;
        AstExporter exporter;
        try {
            validated = new ExportOptionsValidator(frontEnds).validate(options);
            exporter = new AstExporter(validated.getExporterOptions());
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return ExitCodes.FAILURE;
        } catch (ExportConfigurationException e) {
            e.getErrors().forEach(log::error);
            return ExitCodes.FAILURE;
        }

        printer.printBanner(options, validated);

        List<ExportResult> results = new ArrayList<>();
        for (Map.Entry<Path, Path> entry : validated.getOutputsBySource().entrySet()) {
            Path source = entry.getKey();
            FrontEnd frontEnd = validated.getFrontEndsBySource().get(source);
            try {
                ExportResult result = exportOne(exporter, frontEnd, source, entry.getValue());
                printer.printSuccess(result);
                results.add(result);
            } catch (SchemaException e) {
                log.error("Internal consistency failure while exporting {}", source, e);
                return ExitCodes.INTERNAL_ERROR;
            } catch (IOException | ExportConfigurationException e) {
                ExportResult failure = ExportResult.failure(source, e.getMessage());
                printer.printFailure(failure);
                results.add(failure);
            }
        }

        printer.printSummary(results);
        return results.stream().allMatch(ExportResult::isSuccess) ? ExitCodes.SUCCESS : ExitCodes.FAILURE;
    }

    private ExportResult exportOne(AstExporter exporter, FrontEnd frontEnd, Path source, Path output)
            throws IOException {
        log.debug("Parsing {} with front end {}", source, frontEnd.name());
        TranslationUnitDecl unit = frontEnd.parse(source);
        // Anonymized identities restart at 0 for every unit.
        exporter.getOptions().getIdentityTable().ifPresent(IdentityTable::reset);
        ExportResult result = exporter.export(unit, output);
        result.setSource(source);
        return result;
    }
}
