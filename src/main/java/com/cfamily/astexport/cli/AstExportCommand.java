package com.cfamily.astexport.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Top-level command; all work happens in the subcommands.
 */
@Command(
        name = "ast-export",
        mixinStandardHelpOptions = true,
        version = "ast-exporter 1.0.0",
        description = "Exports C-family compiler ASTs and inspects their identity indexes.",
        subcommands = {ExportCommand.class, IndexCommand.class, SchemaCommand.class}
)
public class AstExportCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return ExitCodes.FAILURE;
    }
}
