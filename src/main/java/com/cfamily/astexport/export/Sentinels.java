package com.cfamily.astexport.export;

import com.cfamily.astexport.model.NodeId;
import com.cfamily.astexport.model.comment.Comment;
import com.cfamily.astexport.model.comment.CommentKind;
import com.cfamily.astexport.model.decl.DeclKind;
import com.cfamily.astexport.model.decl.EmptyDecl;
import com.cfamily.astexport.model.stmt.Stmt;
import com.cfamily.astexport.model.stmt.StmtKind;
import com.cfamily.astexport.model.type.Type;
import com.cfamily.astexport.model.type.TypeKind;

/**
 * Placeholders for logically absent required children, one set per pass.
 * <p>
 * Their identities are fixed so that the exporter and the index builder agree on them.
 * The instances are shared by every substitution and must not be modified.
 */
public class Sentinels {

    private final EmptyDecl decl = EmptyDecl.builder()
            .kind(DeclKind.EMPTY)
            .id(NodeId.SENTINEL_DECL)
            .build();

    private final Stmt stmt = Stmt.builder()
            .kind(StmtKind.NULL_STMT)
            .id(NodeId.SENTINEL_STMT)
            .build();

    private final Comment comment = Comment.builder()
            .kind(CommentKind.NO_COMMENT)
            .id(NodeId.SENTINEL_COMMENT)
            .build();

    private final Type absentType = Type.builder()
            .kind(TypeKind.NONE)
            .id(NodeId.ABSENT)
            .spelling("")
            .build();

    public EmptyDecl decl() {
        return decl;
    }

    public Stmt stmt() {
        return stmt;
    }

    public Comment comment() {
        return comment;
    }

    /**
     * The absent-type variant. Not a sentinel in the strict sense: it is defined once, as the
     * last entry of the type list, and every absent type slot refers to it.
     */
    public Type absentType() {
        return absentType;
    }

    public boolean isSentinel(Object node) {
        return node == decl || node == stmt || node == comment;
    }
}
