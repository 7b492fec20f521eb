package com.cfamily.astexport.model;

import com.cfamily.astexport.model.decl.StorageClass;
import com.cfamily.astexport.model.stmt.CastKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class VariantNamesTest {

    @Test
    void testEnumConstantToVariant() {
        assertThat(VariantNames.of(StorageClass.NONE)).isEqualTo("None");
        assertThat(VariantNames.of(CastKind.LVALUE_TO_RVALUE)).isEqualTo("LvalueToRvalue");
    }

    @ParameterizedTest
    @CsvSource({
            "CXXRecordDecl, cxx_record_decl",
            "VarDecl, var_decl",
            "ObjCMethodDecl, obj_c_method_decl",
            "NoneType, none_type",
            "Stmt, stmt"
    })
    void testVariantToSnakeCase(String variant, String expected) {
        assertThat(VariantNames.toSnakeCase(variant)).isEqualTo(expected);
    }

    @Test
    void testNodeIdRendering() {
        assertThat(NodeId.ABSENT.toRawString()).isEqualTo("0x0");
        assertThat(NodeId.SENTINEL_DECL.toRawString()).isEqualTo("0xffffffffffffffff");
        assertThat(NodeId.of(0x7f3a10L).toRawString()).isEqualTo("0x7f3a10");
        assertThat(NodeId.SENTINEL_COMMENT.isReserved()).isTrue();
        assertThat(NodeId.of(1L).isReserved()).isFalse();
    }
}
