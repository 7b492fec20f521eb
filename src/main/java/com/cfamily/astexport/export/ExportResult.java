package com.cfamily.astexport.export;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Outcome of exporting one translation unit.
 */
@Data
@Builder
public class ExportResult {
    private boolean success;
    private String errorMessage;
    private Path source;
    private Path outputPath;

    private int declarations;
    private int statements;
    private int types;
    private int comments;
    private int sentinels;
    private int skippedDeclarations;
    private int danglingTypeReferences;

    public static ExportResult success(Path source, Path outputPath, ExportCounters counters) {
        return ExportResult.builder()
                .success(true)
                .source(source)
                .outputPath(outputPath)
                .declarations(counters.getDeclarations())
                .statements(counters.getStatements())
                .types(counters.getTypes())
                .comments(counters.getComments())
                .sentinels(counters.getSentinels())
                .skippedDeclarations(counters.getSkippedDeclarations())
                .danglingTypeReferences(counters.getDanglingTypeReferences())
                .build();
    }

    public static ExportResult failure(Path source, String errorMessage) {
        return ExportResult.builder()
                .success(false)
                .source(source)
                .errorMessage(errorMessage)
                .build();
    }
}
