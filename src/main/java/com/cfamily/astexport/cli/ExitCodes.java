package com.cfamily.astexport.cli;

/**
 * Process exit codes shared by all subcommands.
 */
final class ExitCodes {

    static final int SUCCESS = 0;
    /** Invalid options, unreadable input or failed output. */
    static final int FAILURE = 1;
    /** Kind tree or arity inconsistency; indicates a bug, not bad input. */
    static final int INTERNAL_ERROR = 2;

    private ExitCodes() {
        // Constants
    }
}
