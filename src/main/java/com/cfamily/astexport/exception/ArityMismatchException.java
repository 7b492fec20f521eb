package com.cfamily.astexport.exception;

/**
 * A scope received a different number of values than it declared.
 */
public class ArityMismatchException extends SchemaException {

    private static final long serialVersionUID = 1L;

    public ArityMismatchException(String message) {
        super(message);
    }
}
