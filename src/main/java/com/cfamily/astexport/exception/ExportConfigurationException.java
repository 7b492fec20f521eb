package com.cfamily.astexport.exception;

import java.util.List;

/**
 * Invalid exporter configuration, reported before any output is written.
 * Holds every problem found, not just the first.
 */
public class ExportConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public ExportConfigurationException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public ExportConfigurationException(String error, Throwable cause) {
        super(error, cause);
        this.errors = List.of(error);
    }

    public List<String> getErrors() {
        return errors;
    }
}
