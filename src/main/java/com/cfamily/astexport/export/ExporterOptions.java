package com.cfamily.astexport.export;

import com.cfamily.astexport.writer.OutputFormat;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Exporter configuration.
 * <p>
 * With {@code emitRawIdentities} off, identities are renumbered through
 * {@code identityTable}; a fresh table is used when none is supplied. The deduplicator,
 * when present, must be shared by all units of a run.
 */
@Value
@Builder
public class ExporterOptions {

    @Builder.Default
    boolean emitRawIdentities = true;

    boolean prettyPrint;

    @Builder.Default
    PathNormalizer pathNormalizer = PathNormalizer.identity();

    @Builder.Default
    OutputFormat format = OutputFormat.JSON;

    FileDeduplicator deduplicator;

    IdentityTable identityTable;

    public static ExporterOptions defaults() {
        return ExporterOptions.builder().build();
    }

    public Optional<FileDeduplicator> getDeduplicator() {
        return Optional.ofNullable(deduplicator);
    }

    public Optional<IdentityTable> getIdentityTable() {
        return Optional.ofNullable(identityTable);
    }
}
