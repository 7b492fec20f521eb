package com.cfamily.astexport.index;

import com.cfamily.astexport.AstFixtures;
import com.cfamily.astexport.export.AstExporter;
import com.cfamily.astexport.export.ExporterOptions;
import com.cfamily.astexport.model.NodeId;
import com.cfamily.astexport.model.decl.Decl;
import com.cfamily.astexport.model.decl.TranslationUnitDecl;
import com.cfamily.astexport.model.stmt.Stmt;
import com.cfamily.astexport.model.type.Type;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class IdentityIndexerTest {

    private static final String MAIN = "/work/src/main.c";

    private IdentityIndexer indexer;
    private TranslationUnitDecl unit;

    @BeforeEach
    void setUp() {
        indexer = new IdentityIndexer();
        unit = new AstFixtures().sampleUnit(MAIN);
    }

    @Test
    void testIndexCoversEveryDefinedNode() {
        IdentityIndex index = indexer.build(unit);

        assertThat(index.getDeclarations()).hasSize(9);
        // 13 statements plus the sentinel for the missing else branch
        assertThat(index.getStatements()).hasSize(14);
        assertThat(index.getTypes()).hasSize(8);
        assertThat(index.size()).isEqualTo(31);

        assertThat(index.findDeclaration(unit.getId())).containsSame(unit);
        assertThat(index.findStatement(NodeId.SENTINEL_STMT)).isPresent();
        assertThat(index.findType(NodeId.ABSENT)).isPresent();
        assertThat(index.findDeclaration(NodeId.of(0x1L))).isEmpty();
    }

    @Test
    void testIndexedIdentitiesAreThoseWrittenByExporter() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new AstExporter(ExporterOptions.defaults()).export(unit, out);
        String document = out.toString(StandardCharsets.UTF_8);

        IdentityIndex index = indexer.build(unit);

        for (Decl decl : index.getDeclarations().values()) {
            assertThat(document).contains(pointerField(decl.getId()));
        }
        for (Stmt stmt : index.getStatements().values()) {
            assertThat(document).contains(pointerField(stmt.getId()));
        }
        for (Type type : index.getTypes().values()) {
            assertThat(document).contains(pointerField(type.getId()));
        }
    }

    @Test
    void testIndexerCanBeReused() {
        IdentityIndex first = indexer.build(unit);
        IdentityIndex second = indexer.build(new AstFixtures().emptyUnit(MAIN));

        assertThat(first.getDeclarations()).hasSize(9);
        assertThat(second.getDeclarations()).hasSize(1);
        assertThat(second.getTypes()).hasSize(1);
    }

    @Test
    void testHistogramCountsKindsOfAllFamilies() {
        KindHistogram histogram = KindHistogram.of(unit);

        assertThat(histogram.count("FunctionDecl")).isEqualTo(1);
        assertThat(histogram.count("ParmVarDecl")).isEqualTo(2);
        assertThat(histogram.count("ReturnStmt")).isEqualTo(2);
        assertThat(histogram.count("NullStmt")).isEqualTo(1);
        assertThat(histogram.count("PointerType")).isEqualTo(2);
        assertThat(histogram.count("NoneType")).isEqualTo(1);
        assertThat(histogram.count("NoComment")).isEqualTo(1);
        assertThat(histogram.count("CXXRecordDecl")).isZero();
        assertThat(histogram.total()).isEqualTo(9 + 14 + 8 + 5);
        assertThat(histogram.asMap()).containsKey("TranslationUnitDecl");
    }

    private static String pointerField(NodeId id) {
        return "\"pointer\":\"" + id.toRawString() + "\"";
    }
}
