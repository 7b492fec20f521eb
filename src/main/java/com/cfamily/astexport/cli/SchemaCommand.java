package com.cfamily.astexport.cli;

import com.cfamily.astexport.exception.SchemaException;
import com.cfamily.astexport.schema.SchemaGenerator;
import com.cfamily.astexport.util.FileWriteUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
        name = "schema",
        mixinStandardHelpOptions = true,
        version = "ast-exporter 1.0.0",
        description = "Prints the tuple layout of every node kind and the variant type of every family."
)
public class SchemaCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SchemaCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"--output", "-o"}, description = "Write the schema to this file instead of standard output")
    private Path output;

    @Option(names = {"--force"}, description = "Overwrite an existing output file")
    private boolean force;

    @Override
    public Integer call() {
        if (output != null && Files.exists(output) && !force) {
            log.error("Output file already exists: {}. Use --force to overwrite.", output);
            return ExitCodes.FAILURE;
        }
        try {
            String schema = new SchemaGenerator().render();
            if (output == null) {
                PrintWriter out = spec.commandLine().getOut();
                out.print(schema);
                out.flush();
            } else {
                FileWriteUtil.safeWriteString(output, schema);
                log.info("Schema written to {}", output.toAbsolutePath());
            }
            return ExitCodes.SUCCESS;
        } catch (IOException e) {
            log.error("Failed to write schema: {}", e.getMessage());
            return ExitCodes.FAILURE;
        } catch (SchemaException e) {
            log.error("Kind tree is inconsistent", e);
            return ExitCodes.INTERNAL_ERROR;
        }
    }
}
