package com.cfamily.astexport.schema;

import com.cfamily.astexport.model.NodeFamily;
import com.cfamily.astexport.model.NodeKind;
import com.cfamily.astexport.model.decl.DeclKind;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.*;

class SchemaGeneratorTest {

    private static String schema;

    @BeforeAll
    static void render() throws IOException {
        schema = new SchemaGenerator().render();
    }

    @Test
    void testRootTuplesHoldOnlyOwnFields() {
        assertThat(schema).contains("#define decl_tuple decl_info\n");
        assertThat(schema).contains("#define stmt_tuple stmt_info * stmt list\n");
    }

    @Test
    void testChildTuplesExtendParentTuple() {
        assertThat(schema).contains("#define var_decl_tuple declarator_decl_tuple * var_decl_info\n");
        assertThat(schema).contains("#define cxx_record_decl_tuple record_decl_tuple * cxx_record_decl_info\n");
        assertThat(schema).contains("#define null_stmt_tuple stmt_tuple\n");
    }

    @ParameterizedTest
    @EnumSource(NodeFamily.class)
    void testEveryConcreteKindIsAVariant(NodeFamily family) {
        assertThat(schema).contains("type " + family.getSchemaName() + " = [");
        for (NodeKind kind : family.kinds()) {
            String variant = "| " + kind.getVariantName() + " of (";
            if (kind.isAbstractKind()) {
                assertThat(schema).doesNotContain(variant);
            } else {
                assertThat(schema).contains(variant);
            }
        }
    }

    @Test
    void testLayoutOfKind() {
        KindLayout layout = KindLayout.of(DeclKind.CXX_RECORD);

        assertThat(layout.getVariantName()).isEqualTo("CXXRecordDecl");
        assertThat(layout.getTupleName()).isEqualTo("cxx_record_decl_tuple");
        assertThat(layout.getParentTupleName()).isEqualTo("record_decl_tuple");
        assertThat(layout.getTupleSize()).isEqualTo(8);
    }

    @Test
    void testRenderToWriterMatchesRenderToString() throws IOException {
        StringWriter out = new StringWriter();
        new SchemaGenerator().render(out);

        assertThat(out.toString()).isEqualTo(schema);
    }
}
