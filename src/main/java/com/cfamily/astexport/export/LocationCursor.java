package com.cfamily.astexport.export;

import com.cfamily.astexport.model.SourceLocation;
import com.cfamily.astexport.model.SourceRange;
import com.cfamily.astexport.writer.AstWriter;
import com.cfamily.astexport.writer.Scope;

import java.io.IOException;
import java.util.Objects;

/**
 * Delta encoder for source positions.
 * <p>
 * Each location is written relative to the previously written one: the file only when it
 * changed, the line only when file or line changed, the column always. An invalid location
 * is an empty object and does not move the cursor. Decoding requires the same pre-order
 * as encoding, so one cursor serves one pass.
 */
public class LocationCursor {

    private static final int UNSET_LINE = -1;

    private final PathNormalizer pathNormalizer;
    private String lastFile = "";
    private int lastLine = UNSET_LINE;

    public LocationCursor(PathNormalizer pathNormalizer) {
        this.pathNormalizer = pathNormalizer;
    }

    public void emitLocation(AstWriter writer, SourceLocation location) throws IOException {
        if (location == null || !location.isValid()) {
            writer.openObject(0).close();
            return;
        }
        boolean fileChanged = !Objects.equals(location.getFile(), lastFile);
        boolean lineChanged = fileChanged || location.getLine() != lastLine;
        int fields = 1 + (lineChanged ? 1 : 0) + (fileChanged ? 1 : 0);

        try (Scope o = writer.openObject(fields)) {
            if (fileChanged) {
                writer.emitTag("file");
                writer.emitString(pathNormalizer.normalize(location.getFile()));
            }
            if (lineChanged) {
                writer.emitTag("line");
                writer.emitInteger(location.getLine());
            }
            writer.emitTag("column");
            writer.emitInteger(location.getColumn());
        }
        lastFile = location.getFile();
        lastLine = location.getLine();
    }

    public void emitRange(AstWriter writer, SourceRange range) throws IOException {
        SourceRange r = range == null ? SourceRange.EMPTY : range;
        try (Scope t = writer.openTuple(2)) {
            emitLocation(writer, r.getBegin());
            emitLocation(writer, r.getEnd());
        }
    }

    public String getLastFile() {
        return lastFile;
    }

    public int getLastLine() {
        return lastLine;
    }

    public void reset() {
        lastFile = "";
        lastLine = UNSET_LINE;
    }
}
