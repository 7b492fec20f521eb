package com.cfamily.astexport.model;

import lombok.Value;

/**
 * A position in a source file. A location without a file is invalid.
 */
@Value
public class SourceLocation {

    public static final SourceLocation INVALID = new SourceLocation(null, 0, 0);

    String file;
    int line;
    int column;

    public static SourceLocation of(String file, int line, int column) {
        return new SourceLocation(file, line, column);
    }

    public boolean isValid() {
        return file != null;
    }
}
