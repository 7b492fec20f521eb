package com.cfamily.astexport.model;

import lombok.Value;

@Value
public class SourceRange {

    public static final SourceRange EMPTY = new SourceRange(SourceLocation.INVALID, SourceLocation.INVALID);

    SourceLocation begin;
    SourceLocation end;

    public static SourceRange of(SourceLocation begin, SourceLocation end) {
        return new SourceRange(begin, end);
    }

    /**
     * File of the range start, or {@code null} when the start is invalid.
     */
    public String getFile() {
        return begin == null ? null : begin.getFile();
    }
}
