package com.cfamily.astexport.export;

import com.cfamily.astexport.exception.ArityMismatchException;
import com.cfamily.astexport.model.BaseSpecifier;
import com.cfamily.astexport.model.NodeFamily;
import com.cfamily.astexport.model.VariantNames;
import com.cfamily.astexport.model.stmt.AddrLabelExpr;
import com.cfamily.astexport.model.stmt.AttributedStmt;
import com.cfamily.astexport.model.stmt.BinaryOperator;
import com.cfamily.astexport.model.stmt.BlockExpr;
import com.cfamily.astexport.model.stmt.CastExpr;
import com.cfamily.astexport.model.stmt.CharacterLiteral;
import com.cfamily.astexport.model.stmt.CompoundAssignOperator;
import com.cfamily.astexport.model.stmt.CxxBoolLiteralExpr;
import com.cfamily.astexport.model.stmt.CxxCatchStmt;
import com.cfamily.astexport.model.stmt.CxxDeleteExpr;
import com.cfamily.astexport.model.stmt.CxxNamedCastExpr;
import com.cfamily.astexport.model.stmt.CxxNewExpr;
import com.cfamily.astexport.model.stmt.DeclRefExpr;
import com.cfamily.astexport.model.stmt.DeclStmt;
import com.cfamily.astexport.model.stmt.ExplicitCastExpr;
import com.cfamily.astexport.model.stmt.Expr;
import com.cfamily.astexport.model.stmt.FloatingLiteral;
import com.cfamily.astexport.model.stmt.GotoStmt;
import com.cfamily.astexport.model.stmt.IntegerLiteral;
import com.cfamily.astexport.model.stmt.LabelStmt;
import com.cfamily.astexport.model.stmt.LambdaExpr;
import com.cfamily.astexport.model.stmt.MemberExpr;
import com.cfamily.astexport.model.stmt.ObjCMessageExpr;
import com.cfamily.astexport.model.stmt.ObjectKind;
import com.cfamily.astexport.model.stmt.OpaqueValueExpr;
import com.cfamily.astexport.model.stmt.PredefinedExpr;
import com.cfamily.astexport.model.stmt.Stmt;
import com.cfamily.astexport.model.stmt.StmtKind;
import com.cfamily.astexport.model.stmt.StringLiteral;
import com.cfamily.astexport.model.stmt.UnaryExprOrTypeTraitExpr;
import com.cfamily.astexport.model.stmt.UnaryOperator;
import com.cfamily.astexport.model.stmt.ValueKind;
import com.cfamily.astexport.schema.KindHierarchy;
import com.cfamily.astexport.writer.AstWriter;
import com.cfamily.astexport.writer.Scope;

import java.io.IOException;
import java.util.List;

import static com.cfamily.astexport.export.CommonFieldEmitter.count;
import static com.cfamily.astexport.export.CommonFieldEmitter.nonNull;
import static com.cfamily.astexport.export.CommonFieldEmitter.orEmpty;

/**
 * Defines statements and expressions at their position in the tree.
 * <p>
 * Every statement starts with {@code stmt_info} and its child slot list; a {@code null}
 * slot is written as the statement sentinel so slot counts never depend on which optional
 * children are present.
 */
public class StmtEmitter {

    private final ExportSession session;

    StmtEmitter(ExportSession session) {
        this.session = session;
    }

    public void emit(Stmt stmt) throws IOException {
        Stmt s = stmt != null ? stmt : session.getSentinels().stmt();
        StmtKind kind = KindHierarchy.checkDispatchable(s.getKind(), s, NodeFamily.STMT);
        session.getCounters().statement(s == session.getSentinels().stmt());

        AstWriter w = writer();
        try (Scope v = w.openVariant(kind.getVariantName());
                Scope t = w.openTuple(KindHierarchy.tupleSize(kind))) {
            emitFields(kind, s);
        }
    }

    private void emitFields(StmtKind kind, Stmt s) throws IOException {
        if (kind.getParent() != null) {
            emitFields(kind.getParent(), s);
        }
        int emitted = emitOwnFields(kind, s);
        if (emitted != kind.getOwnFieldCount()) {
            throw new ArityMismatchException(kind.getVariantName() + " declares " + kind.getOwnFieldCount()
                    + " own fields but its emitter wrote " + emitted);
        }
    }

    private int emitOwnFields(StmtKind kind, Stmt s) throws IOException {
        AstWriter w = writer();
        return switch (kind) {
            case STMT -> {
                emitStmtInfo(s);
                emitChildren(s.getChildren());
                yield 2;
            }
            case DECL_STMT -> {
                session.getDecls().emitList(((DeclStmt) s).getDecls());
                yield 1;
            }
            case LABEL_STMT -> {
                w.emitString(((LabelStmt) s).getName());
                yield 1;
            }
            case GOTO_STMT -> {
                common().emitLabelRef(((GotoStmt) s).getTarget());
                yield 1;
            }
            case ATTRIBUTED_STMT -> {
                common().emitAttributes(((AttributedStmt) s).getAttributes());
                yield 1;
            }
            case CXX_CATCH_STMT -> {
                emitCxxCatchStmtInfo((CxxCatchStmt) s);
                yield 1;
            }
            case EXPR -> {
                emitExprInfo((Expr) s);
                yield 1;
            }
            case INTEGER_LITERAL -> {
                emitIntegerLiteralInfo((IntegerLiteral) s);
                yield 1;
            }
            case FLOATING_LITERAL -> {
                w.emitString(((FloatingLiteral) s).getValue());
                yield 1;
            }
            case STRING_LITERAL -> {
                w.emitString(((StringLiteral) s).getValue());
                yield 1;
            }
            case CHARACTER_LITERAL -> {
                w.emitInteger(((CharacterLiteral) s).getValue());
                yield 1;
            }
            case CXX_BOOL_LITERAL_EXPR -> {
                w.emitBoolean(((CxxBoolLiteralExpr) s).isValue());
                yield 1;
            }
            case DECL_REF_EXPR -> {
                emitDeclRefExprInfo((DeclRefExpr) s);
                yield 1;
            }
            case MEMBER_EXPR -> {
                emitMemberExprInfo((MemberExpr) s);
                yield 1;
            }
            case UNARY_OPERATOR -> {
                emitUnaryOperatorInfo((UnaryOperator) s);
                yield 1;
            }
            case BINARY_OPERATOR -> {
                emitBinaryOperatorInfo((BinaryOperator) s);
                yield 1;
            }
            case COMPOUND_ASSIGN_OPERATOR -> {
                emitCompoundAssignOperatorInfo((CompoundAssignOperator) s);
                yield 1;
            }
            case CAST_EXPR -> {
                emitCastExprInfo((CastExpr) s);
                yield 1;
            }
            case EXPLICIT_CAST_EXPR -> {
                common().emitQualType(((ExplicitCastExpr) s).getTypeAsWritten());
                yield 1;
            }
            case CXX_NAMED_CAST_EXPR -> {
                w.emitString(((CxxNamedCastExpr) s).getCastName());
                yield 1;
            }
            case UNARY_EXPR_OR_TYPE_TRAIT_EXPR -> {
                emitTraitExprInfo((UnaryExprOrTypeTraitExpr) s);
                yield 1;
            }
            case PREDEFINED_EXPR -> {
                PredefinedExpr predefined = (PredefinedExpr) s;
                w.emitSimpleVariant(predefined.getIdentKind() == null ? "Func"
                        : VariantNames.of(predefined.getIdentKind()));
                yield 1;
            }
            case OPAQUE_VALUE_EXPR -> {
                emitOpaqueValueExprInfo((OpaqueValueExpr) s);
                yield 1;
            }
            case BLOCK_EXPR -> {
                session.getDecls().emit(((BlockExpr) s).getBlock());
                yield 1;
            }
            case LAMBDA_EXPR -> {
                session.getDecls().emit(((LambdaExpr) s).getLambdaClass());
                yield 1;
            }
            case CXX_NEW_EXPR -> {
                emitCxxNewExprInfo((CxxNewExpr) s);
                yield 1;
            }
            case CXX_DELETE_EXPR -> {
                CxxDeleteExpr delete = (CxxDeleteExpr) s;
                try (Scope o = w.openObject(count(delete.isArray(), delete.isGlobalDelete()))) {
                    w.emitFlag("is_array", delete.isArray());
                    w.emitFlag("is_global", delete.isGlobalDelete());
                }
                yield 1;
            }
            case OBJC_MESSAGE_EXPR -> {
                emitObjCMessageExprInfo((ObjCMessageExpr) s);
                yield 1;
            }
            case ADDR_LABEL_EXPR -> {
                common().emitLabelRef(((AddrLabelExpr) s).getLabel());
                yield 1;
            }
            case NULL_STMT, COMPOUND_STMT, IF_STMT, WHILE_STMT, DO_STMT, FOR_STMT, SWITCH_STMT, RETURN_STMT,
                    BREAK_STMT, CONTINUE_STMT, CXX_TRY_STMT, SWITCH_CASE, CASE_STMT, DEFAULT_STMT,
                    CXX_NULL_PTR_LITERAL_EXPR, CXX_THIS_EXPR, PAREN_EXPR, CALL_EXPR, CXX_MEMBER_CALL_EXPR,
                    CONDITIONAL_OPERATOR, ARRAY_SUBSCRIPT_EXPR, INIT_LIST_EXPR, IMPLICIT_CAST_EXPR,
                    C_STYLE_CAST_EXPR, CXX_STATIC_CAST_EXPR, CXX_REINTERPRET_CAST_EXPR, CXX_CONST_CAST_EXPR,
                    CXX_DYNAMIC_CAST_EXPR -> 0;
        };
    }

    /**
     * {@code {pointer, source_range}}.
     */
    private void emitStmtInfo(Stmt s) throws IOException {
        AstWriter w = writer();
        try (Scope o = w.openObject(2)) {
            w.emitTag("pointer");
            common().emitPointer(s.getId());
            w.emitTag("source_range");
            common().emitRange(s.getRange());
        }
    }

    private void emitChildren(List<Stmt> children) throws IOException {
        List<Stmt> slots = orEmpty(children);
        try (Scope a = writer().openArray(slots.size())) {
            for (Stmt child : slots) {
                emit(child);
            }
        }
    }

    private void emitCxxCatchStmtInfo(CxxCatchStmt s) throws IOException {
        AstWriter w = writer();
        boolean hasVariable = s.getVariable() != null;
        try (Scope o = w.openObject(count(hasVariable))) {
            if (hasVariable) {
                w.emitTag("variable");
                session.getDecls().emit(s.getVariable());
            }
        }
    }

    /**
     * {@code {qual_type, ?value_kind, ?object_kind}}; defaults are omitted.
     */
    private void emitExprInfo(Expr e) throws IOException {
        AstWriter w = writer();
        boolean hasValueKind = e.getValueKind() != null && e.getValueKind() != ValueKind.RVALUE;
        boolean hasObjectKind = e.getObjectKind() != null && e.getObjectKind() != ObjectKind.ORDINARY;
        try (Scope o = w.openObject(1 + count(hasValueKind, hasObjectKind))) {
            w.emitTag("qual_type");
            common().emitQualType(e.getType());
            if (hasValueKind) {
                w.emitTag("value_kind");
                w.emitSimpleVariant(VariantNames.of(e.getValueKind()));
            }
            if (hasObjectKind) {
                w.emitTag("object_kind");
                w.emitSimpleVariant(VariantNames.of(e.getObjectKind()));
            }
        }
    }

    private void emitIntegerLiteralInfo(IntegerLiteral literal) throws IOException {
        AstWriter w = writer();
        try (Scope o = w.openObject(2 + count(literal.isSigned()))) {
            w.emitFlag("is_signed", literal.isSigned());
            w.emitTag("bitwidth");
            w.emitInteger(literal.getBitWidth());
            w.emitTag("value");
            w.emitString(literal.getValue());
        }
    }

    /**
     * {@code {?decl_ref, ?found_decl_ref}}; the found declaration only when it differs.
     */
    private void emitDeclRefExprInfo(DeclRefExpr e) throws IOException {
        AstWriter w = writer();
        boolean hasDecl = e.getDecl() != null;
        boolean hasFound = e.getFoundDecl() != null && e.getFoundDecl() != e.getDecl();
        try (Scope o = w.openObject(count(hasDecl, hasFound))) {
            if (hasDecl) {
                w.emitTag("decl_ref");
                common().emitDeclRef(e.getDecl());
            }
            if (hasFound) {
                w.emitTag("found_decl_ref");
                common().emitDeclRef(e.getFoundDecl());
            }
        }
    }

    private void emitMemberExprInfo(MemberExpr e) throws IOException {
        AstWriter w = writer();
        String name = e.getMemberDecl() == null || e.getMemberDecl().getName() == null
                ? ""
                : e.getMemberDecl().getName();
        try (Scope o = w.openObject(2 + count(e.isArrow()))) {
            w.emitFlag("is_arrow", e.isArrow());
            w.emitTag("name");
            w.emitString(name);
            w.emitTag("decl_ref");
            common().emitDeclRef(e.getMemberDecl());
        }
    }

    private void emitUnaryOperatorInfo(UnaryOperator e) throws IOException {
        AstWriter w = writer();
        try (Scope o = w.openObject(1 + count(e.isPostfix()))) {
            w.emitTag("kind");
            w.emitSimpleVariant(e.getOpcode() == null ? "Unknown" : VariantNames.of(e.getOpcode()));
            w.emitFlag("is_postfix", e.isPostfix());
        }
    }

    private void emitBinaryOperatorInfo(BinaryOperator e) throws IOException {
        AstWriter w = writer();
        try (Scope o = w.openObject(1)) {
            w.emitTag("kind");
            w.emitSimpleVariant(e.getOpcode() == null ? "Unknown" : VariantNames.of(e.getOpcode()));
        }
    }

    private void emitCompoundAssignOperatorInfo(CompoundAssignOperator e) throws IOException {
        AstWriter w = writer();
        try (Scope o = w.openObject(2)) {
            w.emitTag("lhs_type");
            common().emitQualType(e.getComputationLhsType());
            w.emitTag("result_type");
            common().emitQualType(e.getComputationResultType());
        }
    }

    /**
     * {@code {cast_kind, base_path}}; each base path entry is {@code {name, ~is_virtual}}.
     */
    private void emitCastExprInfo(CastExpr e) throws IOException {
        AstWriter w = writer();
        List<BaseSpecifier> path = nonNull(e.getBasePath());
        try (Scope o = w.openObject(2)) {
            w.emitTag("cast_kind");
            w.emitSimpleVariant(e.getCastKind() == null ? "Dependent" : VariantNames.of(e.getCastKind()));
            w.emitTag("base_path");
            try (Scope a = w.openArray(path.size())) {
                for (BaseSpecifier base : path) {
                    try (Scope b = w.openObject(1 + count(base.isVirtual()))) {
                        w.emitTag("name");
                        w.emitString(base.getName());
                        w.emitFlag("is_virtual", base.isVirtual());
                    }
                }
            }
        }
    }

    private void emitTraitExprInfo(UnaryExprOrTypeTraitExpr e) throws IOException {
        AstWriter w = writer();
        boolean hasType = e.getArgumentType() != null;
        try (Scope o = w.openObject(1 + count(hasType))) {
            w.emitTag("kind");
            w.emitSimpleVariant(e.getTrait() == null ? "SizeOf" : VariantNames.of(e.getTrait()));
            if (hasType) {
                w.emitTag("qual_type");
                common().emitQualType(e.getArgumentType());
            }
        }
    }

    private void emitOpaqueValueExprInfo(OpaqueValueExpr e) throws IOException {
        AstWriter w = writer();
        boolean hasSource = e.getSourceExpr() != null;
        try (Scope o = w.openObject(count(hasSource))) {
            if (hasSource) {
                w.emitTag("source_expr");
                emit(e.getSourceExpr());
            }
        }
    }

    /**
     * Array size and initializer are children of the expression; they are referenced here.
     */
    private void emitCxxNewExprInfo(CxxNewExpr e) throws IOException {
        AstWriter w = writer();
        boolean hasSize = e.getArraySize() != null;
        boolean hasInit = e.getInitializer() != null;
        try (Scope o = w.openObject(count(e.isArray(), e.isGlobal(), hasSize, hasInit))) {
            w.emitFlag("is_array", e.isArray());
            w.emitFlag("is_global", e.isGlobal());
            if (hasSize) {
                w.emitTag("array_size_expr");
                common().emitPointer(e.getArraySize().getId());
            }
            if (hasInit) {
                w.emitTag("initializer_expr");
                common().emitPointer(e.getInitializer().getId());
            }
        }
    }

    private void emitObjCMessageExprInfo(ObjCMessageExpr e) throws IOException {
        AstWriter w = writer();
        boolean hasClassType = e.getClassType() != null;
        boolean hasMethod = e.getMethod() != null;
        try (Scope o = w.openObject(2 + count(hasClassType, hasMethod))) {
            w.emitTag("selector");
            w.emitString(e.getSelector());
            w.emitTag("receiver_kind");
            w.emitSimpleVariant(e.getReceiverKind() == null
                    ? "Instance"
                    : VariantNames.of(e.getReceiverKind()));
            if (hasClassType) {
                w.emitTag("class_type");
                common().emitQualType(e.getClassType());
            }
            if (hasMethod) {
                w.emitTag("decl_pointer");
                common().emitPointer(e.getMethod().getId());
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
