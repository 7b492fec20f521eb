package com.cfamily.astexport.export;

import com.cfamily.astexport.model.decl.Decl;
import com.cfamily.astexport.model.decl.TranslationUnitDecl;
import com.cfamily.astexport.writer.AstWriter;
import lombok.Getter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * State of one export pass over one translation unit: the writer, the location cursor,
 * the identity encoder, the sentinels and the unit's type list, plus the four family
 * dispatchers that share them.
 * <p>
 * The pass is strictly sequential. A session rejects reentrant use and serves a single
 * unit.
 */
@Getter
public class ExportSession {

    private final AstWriter writer;
    private final IdentityEncoder identities;
    private final LocationCursor locations;
    private final Sentinels sentinels = new Sentinels();
    private final ExportCounters counters = new ExportCounters();
    private final FileDeduplicator deduplicator;
    private final PathNormalizer pathNormalizer;

    private final CommonFieldEmitter common;
    private final DeclEmitter decls;
    private final StmtEmitter stmts;
    private final TypeEmitter types;
    private final CommentEmitter comments;

    private TypeArena typeArena;
    private boolean inUse;
    private boolean finished;

    public ExportSession(AstWriter writer, ExporterOptions options) {
        this.writer = writer;
        IdentityTable table = options.getIdentityTable().orElseGet(IdentityTable::new);
        this.identities = new IdentityEncoder(options.isEmitRawIdentities(), table);
        this.pathNormalizer = options.getPathNormalizer();
        this.locations = new LocationCursor(pathNormalizer);
        this.deduplicator = options.getDeduplicator().orElse(null);
        this.common = new CommonFieldEmitter(this);
        this.decls = new DeclEmitter(this);
        this.stmts = new StmtEmitter(this);
        this.types = new TypeEmitter(this);
        this.comments = new CommentEmitter(this);
    }

    /**
     * Writes {@code unit} as a single document and flushes the writer.
     */
    public ExportCounters export(TranslationUnitDecl unit) throws IOException {
        if (inUse) {
            throw new IllegalStateException("Export session is already running");
        }
        if (finished) {
            throw new IllegalStateException("Export session has already exported a translation unit");
        }
        inUse = true;
        try {
            typeArena = TypeArena.build(unit, sentinels.absentType());
            if (deduplicator != null) {
                deduplicator.beginUnit(unit.getMainFile(), pathNormalizer);
            }
            decls.emit(unit);
            writer.flush();
            return counters;
        } finally {
            inUse = false;
            finished = true;
        }
    }

    /**
     * Declarations of a context that this pass emits, after deduplication.
     * Absent entries are kept; they become the declaration sentinel.
     */
    List<Decl> declsToEmit(List<Decl> contextDecls) {
        if (contextDecls == null) {
            return List.of();
        }
        if (deduplicator == null) {
            return contextDecls;
        }
        List<Decl> kept = new ArrayList<>(contextDecls.size());
        for (Decl decl : contextDecls) {
            if (deduplicator.shouldEmit(decl)) {
                kept.add(decl);
            } else {
                counters.skippedDeclaration();
            }
        }
        return kept;
    }
}
