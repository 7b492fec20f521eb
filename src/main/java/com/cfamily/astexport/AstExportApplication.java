package com.cfamily.astexport;

import com.cfamily.astexport.cli.AstExportCommand;
import picocli.CommandLine;

/**
 * Main entry point for the AST exporter.
 * Front ends are picked up from the class path; see {@link com.cfamily.astexport.frontend.FrontEnd}.
 */
public class AstExportApplication {

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    public static CommandLine newCommandLine() {
        return new CommandLine(new AstExportCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
