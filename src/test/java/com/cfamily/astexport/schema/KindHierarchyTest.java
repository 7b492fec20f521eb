package com.cfamily.astexport.schema;

import com.cfamily.astexport.exception.SchemaException;
import com.cfamily.astexport.exception.UnknownKindException;
import com.cfamily.astexport.model.NodeFamily;
import com.cfamily.astexport.model.NodeKind;
import com.cfamily.astexport.model.decl.DeclKind;
import com.cfamily.astexport.model.decl.EmptyDecl;
import com.cfamily.astexport.model.decl.VarDecl;
import com.cfamily.astexport.model.stmt.Stmt;
import com.cfamily.astexport.model.stmt.StmtKind;
import com.cfamily.astexport.model.type.TypeKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class KindHierarchyTest {

    @ParameterizedTest
    @EnumSource(NodeFamily.class)
    void testEveryFamilyTableIsConsistent(NodeFamily family) {
        assertThat(KindHierarchy.validate(family)).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(NodeFamily.class)
    void testTupleSizeIsSumOfLineage(NodeFamily family) {
        for (NodeKind kind : family.kinds()) {
            int expected = KindHierarchy.lineage(kind).stream().mapToInt(NodeKind::getOwnFieldCount).sum();
            assertThat(KindHierarchy.tupleSize(kind)).as(kind.getVariantName()).isEqualTo(expected);
        }
    }

    @Test
    void testDeclarationTupleSizes() {
        assertThat(KindHierarchy.tupleSize(DeclKind.EMPTY)).isEqualTo(1);
        assertThat(KindHierarchy.tupleSize(DeclKind.TRANSLATION_UNIT)).isEqualTo(4);
        assertThat(KindHierarchy.tupleSize(DeclKind.VAR)).isEqualTo(4);
        assertThat(KindHierarchy.tupleSize(DeclKind.PARM_VAR)).isEqualTo(4);
        assertThat(KindHierarchy.tupleSize(DeclKind.CXX_RECORD)).isEqualTo(8);
    }

    @Test
    void testTupleSizeOfResolvesVariantNames() {
        assertThat(KindHierarchy.tupleSizeOf(NodeFamily.STMT, "NullStmt")).isEqualTo(2);
        assertThat(KindHierarchy.tupleSizeOf(NodeFamily.STMT, "IntegerLiteral")).isEqualTo(4);
        assertThat(KindHierarchy.tupleSizeOf(NodeFamily.STMT, "CompoundAssignOperator")).isEqualTo(5);
        assertThat(KindHierarchy.tupleSizeOf(NodeFamily.STMT, "CXXStaticCastExpr")).isEqualTo(6);
        assertThat(KindHierarchy.tupleSizeOf(NodeFamily.TYPE, "NoneType")).isEqualTo(1);
        assertThat(KindHierarchy.tupleSizeOf(NodeFamily.TYPE, "LValueReferenceType")).isEqualTo(2);
        assertThat(KindHierarchy.tupleSizeOf(NodeFamily.TYPE, "ConstantArrayType")).isEqualTo(3);
        assertThat(KindHierarchy.tupleSizeOf(NodeFamily.TYPE, "FunctionProtoType")).isEqualTo(3);
        assertThat(KindHierarchy.tupleSizeOf(NodeFamily.COMMENT, "NoComment")).isEqualTo(2);
        assertThat(KindHierarchy.tupleSizeOf(NodeFamily.COMMENT, "ParamCommandComment")).isEqualTo(5);
    }

    @Test
    void testTupleSizeOfRejectsAbstractAndUnknownKinds() {
        assertThatThrownBy(() -> KindHierarchy.tupleSizeOf(NodeFamily.DECL, "DeclaratorDecl"))
                .isInstanceOf(UnknownKindException.class)
                .hasMessageContaining("Abstract");
        assertThatThrownBy(() -> KindHierarchy.tupleSizeOf(NodeFamily.TYPE, "VectorType"))
                .isInstanceOf(UnknownKindException.class)
                .hasMessageContaining("VectorType");
        assertThatThrownBy(() -> KindHierarchy.tupleSizeOf(NodeFamily.DECL, "NullStmt"))
                .isInstanceOf(UnknownKindException.class);
    }

    @Test
    void testLineageRunsFromRoot() {
        List<NodeKind> lineage = KindHierarchy.lineage(DeclKind.PARM_VAR);

        assertThat(lineage).containsExactly(DeclKind.DECL, DeclKind.NAMED, DeclKind.VALUE, DeclKind.DECLARATOR,
                DeclKind.VAR, DeclKind.PARM_VAR);
    }

    @Test
    void testCheckDispatchable() {
        VarDecl var = new VarDecl();

        assertThat(KindHierarchy.checkDispatchable(DeclKind.PARM_VAR, var, NodeFamily.DECL))
                .isEqualTo(DeclKind.PARM_VAR);
        assertThatThrownBy(() -> KindHierarchy.checkDispatchable(null, var, NodeFamily.DECL))
                .isInstanceOf(UnknownKindException.class);
        assertThatThrownBy(() -> KindHierarchy.checkDispatchable(DeclKind.VALUE, var, NodeFamily.DECL))
                .isInstanceOf(UnknownKindException.class);
        assertThatThrownBy(() -> KindHierarchy.checkDispatchable(DeclKind.VAR, new EmptyDecl(), NodeFamily.DECL))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("VarDecl");
        assertThatThrownBy(() -> KindHierarchy.checkDispatchable(StmtKind.IF_STMT, new VarDecl(), NodeFamily.STMT))
                .isInstanceOf(SchemaException.class);
        assertThat(KindHierarchy.checkDispatchable(StmtKind.IF_STMT, new Stmt(), NodeFamily.STMT))
                .isEqualTo(StmtKind.IF_STMT);
    }

    @Test
    void testEveryConcreteKindOfEveryFamilyIsResolvable() {
        for (NodeFamily family : NodeFamily.values()) {
            for (NodeKind kind : family.kinds()) {
                assertThat(KindHierarchy.resolve(family, kind.getVariantName())).isSameAs(kind);
                assertThat(kind.getFamily()).isEqualTo(family);
            }
        }
        assertThat(TypeKind.NONE.isAbstractKind()).isFalse();
    }
}
