package com.cfamily.astexport.cli;

import com.cfamily.astexport.cli.output.ExportResultsPrinter;
import com.cfamily.astexport.exception.SchemaException;
import com.cfamily.astexport.frontend.FrontEnd;
import com.cfamily.astexport.frontend.FrontEndRegistry;
import com.cfamily.astexport.index.IdentityIndex;
import com.cfamily.astexport.index.IdentityIndexer;
import com.cfamily.astexport.index.KindHistogram;
import com.cfamily.astexport.model.decl.TranslationUnitDecl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Parses one source and reports the identity index and per-kind node counts a consumer
 * of its exported document would build.
 */
@Command(
        name = "index",
        mixinStandardHelpOptions = true,
        version = "ast-exporter 1.0.0",
        description = "Builds the identity index of a source file and prints its statistics."
)
public class IndexCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(IndexCommand.class);

    @Parameters(index = "0", paramLabel = "SOURCE", description = "Source file to parse")
    private Path source;

    @Option(names = {"--front-end"}, description = "Front end to use (default: first one supporting the source)")
    private String frontEndName;

    private final FrontEndRegistry frontEnds;
    private final ExportResultsPrinter printer = new ExportResultsPrinter();

    public IndexCommand() {
        this(FrontEndRegistry.load());
    }

    public IndexCommand(FrontEndRegistry frontEnds) {
        this.frontEnds = frontEnds;
    }

    @Override
    public Integer call() {
        if (!Files.isRegularFile(source)) {
            log.error("Source file does not exist or is not a file: {}", source);
            return ExitCodes.FAILURE;
        }
        Optional<FrontEnd> frontEnd = frontEnds.select(frontEndName, source);
        if (frontEnd.isEmpty()) {
            log.error("No front end available for {}", source);
            return ExitCodes.FAILURE;
        }

        try {
            TranslationUnitDecl unit = frontEnd.get().parse(source);
            IdentityIndex index = new IdentityIndexer().build(unit);
            printer.printIndex(source, index, KindHistogram.of(unit));
            return ExitCodes.SUCCESS;
        } catch (IOException e) {
            log.error("Failed to parse {}: {}", source, e.getMessage());
            return ExitCodes.FAILURE;
        } catch (SchemaException e) {
            log.error("Internal consistency failure while indexing {}", source, e);
            return ExitCodes.INTERNAL_ERROR;
        }
    }
}
