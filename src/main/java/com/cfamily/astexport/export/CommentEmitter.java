package com.cfamily.astexport.export;

import com.cfamily.astexport.exception.ArityMismatchException;
import com.cfamily.astexport.model.NodeFamily;
import com.cfamily.astexport.model.VariantNames;
import com.cfamily.astexport.model.comment.BlockCommandComment;
import com.cfamily.astexport.model.comment.Comment;
import com.cfamily.astexport.model.comment.CommentKind;
import com.cfamily.astexport.model.comment.InlineCommandComment;
import com.cfamily.astexport.model.comment.ParamCommandComment;
import com.cfamily.astexport.model.comment.TextComment;
import com.cfamily.astexport.model.comment.VerbatimCommandComment;
import com.cfamily.astexport.schema.KindHierarchy;
import com.cfamily.astexport.writer.AstWriter;
import com.cfamily.astexport.writer.Scope;

import java.io.IOException;
import java.util.List;

import static com.cfamily.astexport.export.CommonFieldEmitter.count;
import static com.cfamily.astexport.export.CommonFieldEmitter.orEmpty;

/**
 * Defines documentation comment trees attached to declarations.
 */
public class CommentEmitter {

    private final ExportSession session;

    CommentEmitter(ExportSession session) {
        this.session = session;
    }

    public void emit(Comment comment) throws IOException {
        Comment c = comment != null ? comment : session.getSentinels().comment();
        CommentKind kind = KindHierarchy.checkDispatchable(c.getKind(), c, NodeFamily.COMMENT);
        session.getCounters().comment(c == session.getSentinels().comment());

        AstWriter w = writer();
        try (Scope v = w.openVariant(kind.getVariantName());
                Scope t = w.openTuple(KindHierarchy.tupleSize(kind))) {
            emitFields(kind, c);
        }
    }

    private void emitFields(CommentKind kind, Comment c) throws IOException {
        if (kind.getParent() != null) {
            emitFields(kind.getParent(), c);
        }
        int emitted = emitOwnFields(kind, c);
        if (emitted != kind.getOwnFieldCount()) {
            throw new ArityMismatchException(kind.getVariantName() + " declares " + kind.getOwnFieldCount()
                    + " own fields but its emitter wrote " + emitted);
        }
    }

    private int emitOwnFields(CommentKind kind, Comment c) throws IOException {
        AstWriter w = writer();
        return switch (kind) {
            case COMMENT -> {
                emitCommentInfo(c);
                emitChildren(c.getChildren());
                yield 2;
            }
            case TEXT_COMMENT, VERBATIM_BLOCK_LINE_COMMENT -> {
                w.emitString(((TextComment) c).getText());
                yield 1;
            }
            case INLINE_COMMAND_COMMENT -> {
                emitInlineCommandCommentInfo((InlineCommandComment) c);
                yield 1;
            }
            case BLOCK_COMMAND_COMMENT -> {
                BlockCommandComment block = (BlockCommandComment) c;
                emitBlockCommandCommentInfo(block);
                emit(block.getParagraph());
                yield 2;
            }
            case PARAM_COMMAND_COMMENT -> {
                emitParamCommandCommentInfo((ParamCommandComment) c);
                yield 1;
            }
            case VERBATIM_BLOCK_COMMENT, VERBATIM_LINE_COMMENT -> {
                w.emitString(((VerbatimCommandComment) c).getText());
                yield 1;
            }
            case NO_COMMENT, FULL_COMMENT, INLINE_CONTENT_COMMENT, BLOCK_CONTENT_COMMENT, PARAGRAPH_COMMENT -> 0;
        };
    }

    private void emitCommentInfo(Comment c) throws IOException {
        AstWriter w = writer();
        try (Scope o = w.openObject(2)) {
            w.emitTag("pointer");
            common().emitPointer(c.getId());
            w.emitTag("source_range");
            common().emitRange(c.getRange());
        }
    }

    private void emitChildren(List<Comment> children) throws IOException {
        List<Comment> items = orEmpty(children);
        try (Scope a = writer().openArray(items.size())) {
            for (Comment child : items) {
                emit(child);
            }
        }
    }

    private void emitInlineCommandCommentInfo(InlineCommandComment c) throws IOException {
        AstWriter w = writer();
        List<String> args = orEmpty(c.getArgs());
        boolean hasArgs = !args.isEmpty();
        try (Scope o = w.openObject(2 + count(hasArgs))) {
            w.emitTag("command_name");
            w.emitString(c.getName());
            w.emitTag("render_kind");
            w.emitSimpleVariant(c.getRenderKind() == null ? "Normal" : VariantNames.of(c.getRenderKind()));
            if (hasArgs) {
                w.emitTag("args");
                common().emitStringList(args);
            }
        }
    }

    private void emitBlockCommandCommentInfo(BlockCommandComment c) throws IOException {
        AstWriter w = writer();
        List<String> args = orEmpty(c.getArgs());
        boolean hasArgs = !args.isEmpty();
        try (Scope o = w.openObject(1 + count(hasArgs))) {
            w.emitTag("name");
            w.emitString(c.getName());
            if (hasArgs) {
                w.emitTag("args");
                common().emitStringList(args);
            }
        }
    }

    /**
     * {@code {direction, ~is_direction_explicit, ?param_name, ?param_index}}.
     */
    private void emitParamCommandCommentInfo(ParamCommandComment c) throws IOException {
        AstWriter w = writer();
        boolean hasName = c.getParamName() != null;
        boolean hasIndex = c.getParamIndex() != null;
        try (Scope o = w.openObject(1 + count(c.isDirectionExplicit(), hasName, hasIndex))) {
            w.emitTag("direction");
            w.emitSimpleVariant(c.getDirection() == null ? "In" : VariantNames.of(c.getDirection()));
            w.emitFlag("is_direction_explicit", c.isDirectionExplicit());
            if (hasName) {
                w.emitTag("param_name");
                w.emitString(c.getParamName());
            }
            if (hasIndex) {
                w.emitTag("param_index");
                w.emitInteger(c.getParamIndex());
            }
        }
    }

    private CommonFieldEmitter common() {
        return session.getCommon();
    }

    private AstWriter writer() {
        return session.getWriter();
    }
}
