package com.cfamily.astexport.index;

import com.cfamily.astexport.export.Sentinels;
import com.cfamily.astexport.export.TypeArena;
import com.cfamily.astexport.model.comment.BlockCommandComment;
import com.cfamily.astexport.model.comment.Comment;
import com.cfamily.astexport.model.decl.BlockCapture;
import com.cfamily.astexport.model.decl.BlockDecl;
import com.cfamily.astexport.model.decl.Decl;
import com.cfamily.astexport.model.decl.DeclContext;
import com.cfamily.astexport.model.decl.EnumConstantDecl;
import com.cfamily.astexport.model.decl.FieldDecl;
import com.cfamily.astexport.model.decl.FunctionDecl;
import com.cfamily.astexport.model.decl.ObjCMethodDecl;
import com.cfamily.astexport.model.decl.TranslationUnitDecl;
import com.cfamily.astexport.model.decl.VarDecl;
import com.cfamily.astexport.model.stmt.BlockExpr;
import com.cfamily.astexport.model.stmt.CxxCatchStmt;
import com.cfamily.astexport.model.stmt.DeclStmt;
import com.cfamily.astexport.model.stmt.LambdaExpr;
import com.cfamily.astexport.model.stmt.OpaqueValueExpr;
import com.cfamily.astexport.model.stmt.Stmt;
import com.cfamily.astexport.model.type.Type;

import java.util.List;

/**
 * Pre-order walk over the nodes a tree defines, in the order the exporter writes them.
 * <p>
 * Only definitional edges are followed: declaration contexts, parameters, bodies,
 * initializers, statement children and the unit's type list. Reference edges
 * (pointers, declaration digests, type pointers) are not. Absent required children are
 * replaced by the same sentinels the exporter writes.
 */
public final class AstTraversal {

    private final NodeVisitor visitor;
    private final Sentinels sentinels = new Sentinels();

    private AstTraversal(NodeVisitor visitor) {
        this.visitor = visitor;
    }

    public static void walk(Decl root, NodeVisitor visitor) {
        new AstTraversal(visitor).decl(root);
    }

    private void decl(Decl decl) {
        Decl d = decl != null ? decl : sentinels.decl();
        visitor.visitDecl(d);

        if (d.getFullComment() != null) {
            comment(d.getFullComment());
        }
        if (d instanceof DeclContext context) {
            decls(context.getDecls());
        }
        if (d instanceof TranslationUnitDecl unit) {
            for (Type type : TypeArena.build(unit, sentinels.absentType()).getTypes()) {
                visitor.visitType(type);
            }
        }

        if (d instanceof BlockDecl block) {
            decls(block.getParameters());
            for (BlockCapture capture : nonNull(block.getCaptures())) {
                if (capture.getCopyExpr() != null) {
                    stmt(capture.getCopyExpr());
                }
            }
            optionalStmt(block.getBody());
        } else if (d instanceof ObjCMethodDecl method) {
            decls(method.getParameters());
            optionalStmt(method.getBody());
        } else if (d instanceof EnumConstantDecl constant) {
            optionalStmt(constant.getInit());
        } else if (d instanceof FunctionDecl function) {
            decls(function.getParameters());
            optionalStmt(function.getBody());
        } else if (d instanceof FieldDecl field) {
            optionalStmt(field.getInit());
            optionalStmt(field.getBitWidth());
        } else if (d instanceof VarDecl var) {
            optionalStmt(var.getInit());
        }
    }

    private void decls(List<? extends Decl> decls) {
        if (decls == null) {
            return;
        }
        for (Decl decl : decls) {
            decl(decl);
        }
    }

    private void stmt(Stmt stmt) {
        Stmt s = stmt != null ? stmt : sentinels.stmt();
        visitor.visitStmt(s);

        if (s.getChildren() != null) {
            for (Stmt child : s.getChildren()) {
                stmt(child);
            }
        }

        if (s instanceof DeclStmt declStmt) {
            decls(declStmt.getDecls());
        } else if (s instanceof CxxCatchStmt catchStmt) {
            if (catchStmt.getVariable() != null) {
                decl(catchStmt.getVariable());
            }
        } else if (s instanceof OpaqueValueExpr opaque) {
            optionalStmt(opaque.getSourceExpr());
        } else if (s instanceof BlockExpr blockExpr) {
            decl(blockExpr.getBlock());
        } else if (s instanceof LambdaExpr lambda) {
            decl(lambda.getLambdaClass());
        }
    }

    private void optionalStmt(Stmt stmt) {
        if (stmt != null) {
            stmt(stmt);
        }
    }

    private void comment(Comment comment) {
        Comment c = comment != null ? comment : sentinels.comment();
        visitor.visitComment(c);

        if (c.getChildren() != null) {
            for (Comment child : c.getChildren()) {
                comment(child);
            }
        }
        if (c instanceof BlockCommandComment block) {
            comment(block.getParagraph());
        }
    }

    private static <T> List<T> nonNull(List<T> values) {
        return values == null ? List.of() : values.stream().filter(v -> v != null).toList();
    }
}
