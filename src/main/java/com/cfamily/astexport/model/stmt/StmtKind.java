package com.cfamily.astexport.model.stmt;

import com.cfamily.astexport.model.NodeFamily;
import com.cfamily.astexport.model.NodeKind;
import lombok.Getter;

import java.util.List;

/**
 * Statement and expression kinds. Parents are declared before their children.
 */
@Getter
public enum StmtKind implements NodeKind {

    STMT(null, "Stmt", true, Stmt.class, "stmt_info", "stmt list"),

    NULL_STMT(STMT, "NullStmt", false, Stmt.class),
    COMPOUND_STMT(STMT, "CompoundStmt", false, Stmt.class),
    IF_STMT(STMT, "IfStmt", false, Stmt.class),
    WHILE_STMT(STMT, "WhileStmt", false, Stmt.class),
    DO_STMT(STMT, "DoStmt", false, Stmt.class),
    FOR_STMT(STMT, "ForStmt", false, Stmt.class),
    SWITCH_STMT(STMT, "SwitchStmt", false, Stmt.class),
    RETURN_STMT(STMT, "ReturnStmt", false, Stmt.class),
    BREAK_STMT(STMT, "BreakStmt", false, Stmt.class),
    CONTINUE_STMT(STMT, "ContinueStmt", false, Stmt.class),
    CXX_TRY_STMT(STMT, "CXXTryStmt", false, Stmt.class),
    DECL_STMT(STMT, "DeclStmt", false, DeclStmt.class, "decl list"),
    LABEL_STMT(STMT, "LabelStmt", false, LabelStmt.class, "string"),
    GOTO_STMT(STMT, "GotoStmt", false, GotoStmt.class, "goto_stmt_info"),
    ATTRIBUTED_STMT(STMT, "AttributedStmt", false, AttributedStmt.class, "attribute list"),
    CXX_CATCH_STMT(STMT, "CXXCatchStmt", false, CxxCatchStmt.class, "cxx_catch_stmt_info"),
    SWITCH_CASE(STMT, "SwitchCase", true, Stmt.class),
    CASE_STMT(SWITCH_CASE, "CaseStmt", false, Stmt.class),
    DEFAULT_STMT(SWITCH_CASE, "DefaultStmt", false, Stmt.class),

    EXPR(STMT, "Expr", true, Expr.class, "expr_info"),
    INTEGER_LITERAL(EXPR, "IntegerLiteral", false, IntegerLiteral.class, "integer_literal_info"),
    FLOATING_LITERAL(EXPR, "FloatingLiteral", false, FloatingLiteral.class, "string"),
    STRING_LITERAL(EXPR, "StringLiteral", false, StringLiteral.class, "string"),
    CHARACTER_LITERAL(EXPR, "CharacterLiteral", false, CharacterLiteral.class, "int"),
    CXX_BOOL_LITERAL_EXPR(EXPR, "CXXBoolLiteralExpr", false, CxxBoolLiteralExpr.class, "bool"),
    CXX_NULL_PTR_LITERAL_EXPR(EXPR, "CXXNullPtrLiteralExpr", false, Expr.class),
    CXX_THIS_EXPR(EXPR, "CXXThisExpr", false, Expr.class),
    PAREN_EXPR(EXPR, "ParenExpr", false, Expr.class),
    CALL_EXPR(EXPR, "CallExpr", false, Expr.class),
    CXX_MEMBER_CALL_EXPR(CALL_EXPR, "CXXMemberCallExpr", false, Expr.class),
    CONDITIONAL_OPERATOR(EXPR, "ConditionalOperator", false, Expr.class),
    ARRAY_SUBSCRIPT_EXPR(EXPR, "ArraySubscriptExpr", false, Expr.class),
    INIT_LIST_EXPR(EXPR, "InitListExpr", false, Expr.class),
    DECL_REF_EXPR(EXPR, "DeclRefExpr", false, DeclRefExpr.class, "decl_ref_expr_info"),
    MEMBER_EXPR(EXPR, "MemberExpr", false, MemberExpr.class, "member_expr_info"),
    UNARY_OPERATOR(EXPR, "UnaryOperator", false, UnaryOperator.class, "unary_operator_info"),
    BINARY_OPERATOR(EXPR, "BinaryOperator", false, BinaryOperator.class, "binary_operator_info"),
    COMPOUND_ASSIGN_OPERATOR(BINARY_OPERATOR, "CompoundAssignOperator", false, CompoundAssignOperator.class,
            "compound_assign_operator_info"),
    CAST_EXPR(EXPR, "CastExpr", true, CastExpr.class, "cast_expr_info"),
    IMPLICIT_CAST_EXPR(CAST_EXPR, "ImplicitCastExpr", false, CastExpr.class),
    EXPLICIT_CAST_EXPR(CAST_EXPR, "ExplicitCastExpr", true, ExplicitCastExpr.class, "qual_type"),
    C_STYLE_CAST_EXPR(EXPLICIT_CAST_EXPR, "CStyleCastExpr", false, ExplicitCastExpr.class),
    CXX_NAMED_CAST_EXPR(EXPLICIT_CAST_EXPR, "CXXNamedCastExpr", true, CxxNamedCastExpr.class, "string"),
    CXX_STATIC_CAST_EXPR(CXX_NAMED_CAST_EXPR, "CXXStaticCastExpr", false, CxxNamedCastExpr.class),
    CXX_REINTERPRET_CAST_EXPR(CXX_NAMED_CAST_EXPR, "CXXReinterpretCastExpr", false, CxxNamedCastExpr.class),
    CXX_CONST_CAST_EXPR(CXX_NAMED_CAST_EXPR, "CXXConstCastExpr", false, CxxNamedCastExpr.class),
    CXX_DYNAMIC_CAST_EXPR(CXX_NAMED_CAST_EXPR, "CXXDynamicCastExpr", false, CxxNamedCastExpr.class),
    UNARY_EXPR_OR_TYPE_TRAIT_EXPR(EXPR, "UnaryExprOrTypeTraitExpr", false, UnaryExprOrTypeTraitExpr.class,
            "unary_expr_or_type_trait_expr_info"),
    PREDEFINED_EXPR(EXPR, "PredefinedExpr", false, PredefinedExpr.class, "predefined_expr_type"),
    OPAQUE_VALUE_EXPR(EXPR, "OpaqueValueExpr", false, OpaqueValueExpr.class, "opaque_value_expr_info"),
    BLOCK_EXPR(EXPR, "BlockExpr", false, BlockExpr.class, "decl"),
    LAMBDA_EXPR(EXPR, "LambdaExpr", false, LambdaExpr.class, "decl"),
    CXX_NEW_EXPR(EXPR, "CXXNewExpr", false, CxxNewExpr.class, "cxx_new_expr_info"),
    CXX_DELETE_EXPR(EXPR, "CXXDeleteExpr", false, CxxDeleteExpr.class, "cxx_delete_expr_info"),
    OBJC_MESSAGE_EXPR(EXPR, "ObjCMessageExpr", false, ObjCMessageExpr.class, "obj_c_message_expr_info"),
    ADDR_LABEL_EXPR(EXPR, "AddrLabelExpr", false, AddrLabelExpr.class, "addr_label_expr_info");

    private final StmtKind parent;
    private final String variantName;
    private final boolean abstractKind;
    private final Class<? extends Stmt> nodeClass;
    private final List<String> ownFields;

    StmtKind(StmtKind parent, String variantName, boolean abstractKind, Class<? extends Stmt> nodeClass,
            String... ownFields) {
        this.parent = parent;
        this.variantName = variantName;
        this.abstractKind = abstractKind;
        this.nodeClass = nodeClass;
        this.ownFields = List.of(ownFields);
    }

    @Override
    public NodeFamily getFamily() {
        return NodeFamily.STMT;
    }
}
