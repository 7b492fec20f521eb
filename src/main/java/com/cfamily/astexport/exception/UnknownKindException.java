package com.cfamily.astexport.exception;

/**
 * A node carries no kind, an abstract kind, or a kind name that no family table knows.
 */
public class UnknownKindException extends SchemaException {

    private static final long serialVersionUID = 1L;

    public UnknownKindException(String message) {
        super(message);
    }
}
