package com.cfamily.astexport.exception;

/**
 * Internal-consistency failure between the kind tables, the field emitters and the
 * writer. Fatal: the export is aborted and its partial output is undefined.
 */
public class SchemaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SchemaException(String message) {
        super(message);
    }
}
