package com.cfamily.astexport.index;

import com.cfamily.astexport.model.comment.Comment;
import com.cfamily.astexport.model.decl.Decl;
import com.cfamily.astexport.model.stmt.Stmt;
import com.cfamily.astexport.model.type.Type;

/**
 * Callbacks for {@link AstTraversal}. Each node defined in the tree is passed to exactly
 * one callback, once, before its children.
 */
public interface NodeVisitor {

    default void visitDecl(Decl decl) {
    }

    default void visitStmt(Stmt stmt) {
    }

    default void visitType(Type type) {
    }

    default void visitComment(Comment comment) {
    }
}
