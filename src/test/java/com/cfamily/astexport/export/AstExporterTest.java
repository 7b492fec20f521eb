package com.cfamily.astexport.export;

import com.cfamily.astexport.AstFixtures;
import com.cfamily.astexport.exception.ExportConfigurationException;
import com.cfamily.astexport.model.QualType;
import com.cfamily.astexport.model.decl.Decl;
import com.cfamily.astexport.model.decl.DeclKind;
import com.cfamily.astexport.model.decl.FieldDecl;
import com.cfamily.astexport.model.decl.FunctionDecl;
import com.cfamily.astexport.model.decl.NamespaceDecl;
import com.cfamily.astexport.model.decl.RecordDecl;
import com.cfamily.astexport.model.decl.TranslationUnitDecl;
import com.cfamily.astexport.model.decl.VarDecl;
import com.cfamily.astexport.model.stmt.DeclRefExpr;
import com.cfamily.astexport.model.stmt.Stmt;
import com.cfamily.astexport.model.stmt.StmtKind;
import com.cfamily.astexport.model.type.BuiltinKind;
import com.cfamily.astexport.model.type.BuiltinType;
import com.cfamily.astexport.model.type.ChildType;
import com.cfamily.astexport.model.type.TagType;
import com.cfamily.astexport.model.type.TypeKind;
import com.cfamily.astexport.writer.AstWriter;
import com.cfamily.astexport.writer.AstWriterFactory;
import com.cfamily.astexport.writer.OutputFormat;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AstExporterTest {

    private static final String MAIN = "/work/src/main.c";

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void testTranslationUnitLayout() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ExportCounters counters = new AstExporter(ExporterOptions.defaults())
                .export(new AstFixtures().sampleUnit(MAIN), out);

        JsonNode root = mapper.readTree(out.toByteArray());
        assertThat(root.get(0).asText()).isEqualTo("TranslationUnitDecl");
        JsonNode tuple = root.get(1);
        assertThat(tuple.size()).isEqualTo(4);

        JsonNode decls = tuple.get(1);
        assertThat(decls.size()).isEqualTo(3);
        assertThat(decls.get(0).get(0).asText()).isEqualTo("TypedefDecl");
        assertThat(decls.get(1).get(0).asText()).isEqualTo("RecordDecl");
        assertThat(decls.get(2).get(0).asText()).isEqualTo("FunctionDecl");

        JsonNode types = tuple.get(3);
        assertThat(types.size()).isEqualTo(8);
        JsonNode last = types.get(types.size() - 1);
        assertThat(last.get(0).asText()).isEqualTo("NoneType");
        assertThat(last.get(1).get(0).get("pointer").asText()).isEqualTo("0x0");

        assertThat(counters.getDeclarations()).isEqualTo(9);
        assertThat(counters.getStatements()).isEqualTo(14);
        assertThat(counters.getTypes()).isEqualTo(8);
        assertThat(counters.getComments()).isEqualTo(5);
        assertThat(counters.getSentinels()).isEqualTo(2);
        assertThat(counters.getDanglingTypeReferences()).isZero();
    }

    @Test
    void testTypesReachableOnlyThroughOtherTypesAreListed() throws IOException {
        JsonNode root = exportJson(new AstFixtures().sampleUnit(MAIN), ExporterOptions.defaults());

        List<String> spellings = new ArrayList<>();
        for (JsonNode type : root.get(1).get(3)) {
            spellings.add(type.get(1).get(0).get("raw").asText());
        }
        assertThat(spellings).containsSubsequence("int", "counter_t", "struct point", "int (int, char **)")
                .contains("char", "char *", "char * *");
    }

    @Test
    void testMissingElseBranchIsStatementSentinel() throws IOException {
        JsonNode withoutElse = findVariant(exportJson(new AstFixtures().sampleUnit(MAIN, false),
                ExporterOptions.defaults()), "IfStmt");
        JsonNode withElse = findVariant(exportJson(new AstFixtures().sampleUnit(MAIN, true),
                ExporterOptions.defaults()), "IfStmt");

        JsonNode children = withoutElse.get(1).get(1);
        assertThat(children.size()).isEqualTo(3);
        JsonNode sentinel = children.get(2);
        assertThat(sentinel.get(0).asText()).isEqualTo("NullStmt");
        assertThat(sentinel.get(1).get(0).get("pointer").asText()).isEqualTo("0xfffffffffffffffe");

        JsonNode elseChildren = withElse.get(1).get(1);
        assertThat(elseChildren.size()).isEqualTo(3);
        assertThat(elseChildren.get(2).get(0).asText()).isEqualTo("ReturnStmt");
    }

    @Test
    void testAnonymizedOutputDoesNotDependOnAddresses() throws IOException {
        AstFixtures shifted = new AstFixtures();
        for (int i = 0; i < 5; i++) {
            shifted.nextId();
        }
        ExporterOptions anonymized = ExporterOptions.builder().emitRawIdentities(false).build();

        String first = exportString(new AstFixtures().sampleUnit(MAIN), anonymized);
        String second = exportString(shifted.sampleUnit(MAIN), anonymized);
        String firstRaw = exportString(new AstFixtures().sampleUnit(MAIN), ExporterOptions.defaults());
        String secondRaw = exportString(shifted.sampleUnit(MAIN), ExporterOptions.defaults());

        assertThat(second).isEqualTo(first);
        assertThat(secondRaw).isNotEqualTo(firstRaw);
        assertThat(first).doesNotContain("0x7f3a");
    }

    @Test
    void testSharedIdentityTableKeepsGrowingUntilReset() throws IOException {
        IdentityTable table = new IdentityTable();
        ExporterOptions options = ExporterOptions.builder()
                .emitRawIdentities(false)
                .identityTable(table)
                .build();
        AstExporter exporter = new AstExporter(options);

        String first = exportString(exporter, new AstFixtures().sampleUnit(MAIN));
        int afterFirst = table.size();
        String second = exportString(exporter, new AstFixtures().sampleUnit(MAIN));
        assertThat(second).isEqualTo(first);
        assertThat(table.size()).isEqualTo(afterFirst);

        AstFixtures shifted = new AstFixtures();
        shifted.nextId();
        String third = exportString(exporter, shifted.sampleUnit(MAIN));
        assertThat(third).isNotEqualTo(first);

        table.reset();
        String fourth = exportString(exporter, shifted.sampleUnit(MAIN));
        assertThat(fourth).isEqualTo(first);
    }

    @Test
    void testReferencesToRecursiveRecordsGrowLinearly() throws IOException {
        int four = exportString(recursiveRecords(4), ExporterOptions.defaults()).length();
        int eight = exportString(recursiveRecords(8), ExporterOptions.defaults()).length();
        int twelve = exportString(recursiveRecords(12), ExporterOptions.defaults()).length();

        assertThat(twelve - eight).isCloseTo(eight - four, within(64));
    }

    @Test
    void testTypeOutsideTypeListIsCounted() throws IOException {
        AstFixtures fixtures = new AstFixtures();
        TranslationUnitDecl unit = fixtures.emptyUnit(MAIN);
        BuiltinType unregistered = fixtures.builtin(BuiltinKind.LONG, "long");
        unit.getDecls().add(variable(fixtures, "v", unregistered));

        ExportCounters counters = new AstExporter(ExporterOptions.defaults())
                .export(unit, new ByteArrayOutputStream());

        assertThat(counters.getDanglingTypeReferences()).isEqualTo(1);
        assertThat(counters.getTypes()).isEqualTo(1);
    }

    @Test
    void testDeduplicatorSkipsHeaderDeclarationsOfLaterUnits() throws IOException {
        ExporterOptions options = ExporterOptions.builder().deduplicator(new FileDeduplicator()).build();
        AstExporter exporter = new AstExporter(options);

        ByteArrayOutputStream firstOut = new ByteArrayOutputStream();
        ExportCounters first = exporter.export(new AstFixtures().sampleUnit("/work/src/a.c"), firstOut);
        ByteArrayOutputStream secondOut = new ByteArrayOutputStream();
        ExportCounters second = exporter.export(new AstFixtures().sampleUnit("/work/src/b.c"), secondOut);

        assertThat(first.getSkippedDeclarations()).isZero();
        assertThat(second.getSkippedDeclarations()).isEqualTo(1);
        assertThat(mapper.readTree(secondOut.toByteArray()).get(1).get(1).size()).isEqualTo(2);
        assertThat(second.getDeclarations()).isEqualTo(first.getDeclarations() - 1);
    }

    @Test
    void testDeduplicatorNormalizesHeaderPaths() throws IOException {
        ExporterOptions options = ExporterOptions.builder()
                .deduplicator(new FileDeduplicator())
                .pathNormalizer(PathNormalizer.relativeTo(Path.of("/work")))
                .build();
        AstExporter exporter = new AstExporter(options);

        TranslationUnitDecl a = new AstFixtures().sampleUnit("/work/src/a.c");
        for (Decl decl : AstFixtures.headerDecls(a)) {
            decl.setRange(AstFixtures.range("/work/src/../include/counter.h", 1, 1, 21));
        }
        TranslationUnitDecl b = new AstFixtures().sampleUnit("/work/src/b.c");

        ByteArrayOutputStream firstOut = new ByteArrayOutputStream();
        ExportCounters first = exporter.export(a, firstOut);
        ByteArrayOutputStream secondOut = new ByteArrayOutputStream();
        ExportCounters second = exporter.export(b, secondOut);

        assertThat(firstOut.toString(StandardCharsets.UTF_8)).contains("\"file\":\"include/counter.h\"");
        assertThat(first.getSkippedDeclarations()).isZero();
        assertThat(second.getSkippedDeclarations()).isEqualTo(1);
    }

    @Test
    void testRedeclarationChainIsWrittenAsReferences() throws IOException {
        TranslationUnitDecl unit = new AstFixtures().redeclaredFunction(MAIN);
        NamespaceDecl ns = (NamespaceDecl) unit.getDecls().get(0);
        FunctionDecl prototype = (FunctionDecl) ns.getDecls().get(0);
        FunctionDecl definition = (FunctionDecl) unit.getDecls().get(1);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ExportCounters counters = new AstExporter(ExporterOptions.defaults()).export(unit, out);
        JsonNode root = mapper.readTree(out.toByteArray());

        assertThat(counters.getDeclarations()).isEqualTo(4);
        List<JsonNode> functions = new ArrayList<>();
        collectVariants(root, "FunctionDecl", functions);
        assertThat(functions).hasSize(2);

        JsonNode prototypeInfo = functions.get(0).get(1).get(0);
        assertThat(prototypeInfo.get("pointer").asText()).isEqualTo(prototype.getId().toRawString());
        assertThat(prototypeInfo.get("previous_decl").get(0).asText()).isEqualTo("First");
        assertThat(prototypeInfo.get("previous_decl").get(1).asText()).isEqualTo(definition.getId().toRawString());
        assertThat(prototypeInfo.has("parent_pointer")).isFalse();
        JsonNode prototypeFunction = functions.get(0).get(1).get(3);
        assertThat(prototypeFunction.get("decl_ptr_with_body").asText()).isEqualTo(definition.getId().toRawString());
        assertThat(prototypeFunction.has("body")).isFalse();

        JsonNode definitionInfo = functions.get(1).get(1).get(0);
        assertThat(definitionInfo.get("pointer").asText()).isEqualTo(definition.getId().toRawString());
        assertThat(definitionInfo.get("previous_decl").get(0).asText()).isEqualTo("Previous");
        assertThat(definitionInfo.get("previous_decl").get(1).asText()).isEqualTo(prototype.getId().toRawString());
        assertThat(definitionInfo.get("parent_pointer").asText()).isEqualTo(ns.getId().toRawString());
        assertThat(functions.get(1).get(1).get(3).has("body")).isTrue();

        assertThat(findVariant(root, "NamespaceDecl").get(1).get(0).has("parent_pointer")).isFalse();
    }

    @Test
    void testReferenceToUnnamedDeclarationKeepsName() throws IOException {
        TranslationUnitDecl unit = new AstFixtures().sampleUnit(MAIN);
        VarDecl argc = ((FunctionDecl) unit.getDecls().get(2)).getParameters().get(0);
        argc.setName("");
        argc.setQualifiedName(null);

        List<JsonNode> refs = exportJson(unit, ExporterOptions.defaults()).findValues("decl_ref");

        assertThat(refs).hasSize(2);
        assertThat(refs.get(0).get("decl_pointer").asText()).isEqualTo(argc.getId().toRawString());
        assertThat(refs.get(0).get("name").get("name").asText()).isEmpty();
        assertThat(refs.get(1).get("name").get("name").asText()).isEqualTo("total");
    }

    @Test
    void testCborCarriesSameTreeAsJson() throws IOException {
        ByteArrayOutputStream json = new ByteArrayOutputStream();
        new AstExporter(ExporterOptions.defaults()).export(new AstFixtures().sampleUnit(MAIN), json);
        ByteArrayOutputStream cbor = new ByteArrayOutputStream();
        new AstExporter(ExporterOptions.builder().format(OutputFormat.CBOR).build())
                .export(new AstFixtures().sampleUnit(MAIN), cbor);

        assertThat(new CBORMapper().readTree(cbor.toByteArray())).isEqualTo(mapper.readTree(json.toByteArray()));
    }

    @Test
    void testExportToFileCreatesParentDirectories() throws IOException {
        Path output = tempDir.resolve("nested").resolve("main.c.json");

        ExportResult result = new AstExporter(ExporterOptions.defaults())
                .export(new AstFixtures().sampleUnit(MAIN), output);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOutputPath()).isEqualTo(output);
        assertThat(Files.exists(output)).isTrue();
        assertThat(mapper.readTree(output.toFile()).get(0).asText()).isEqualTo("TranslationUnitDecl");
    }

    @Test
    void testUnwritableOutputIsConfigurationError() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");

        AstExporter exporter = new AstExporter(ExporterOptions.defaults());
        TranslationUnitDecl unit = new AstFixtures().sampleUnit(MAIN);

        assertThatThrownBy(() -> exporter.export(unit, blocker.resolve("out.json")))
                .isInstanceOf(ExportConfigurationException.class)
                .hasMessageContaining("Cannot open output");
    }

    @Test
    void testMissingUnitIsRejected() {
        AstExporter exporter = new AstExporter(ExporterOptions.defaults());

        assertThatThrownBy(() -> exporter.export(null, new ByteArrayOutputStream()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testSessionServesOneUnit() throws IOException {
        AstWriter writer = new AstWriterFactory().create(new ByteArrayOutputStream(), OutputFormat.JSON, false);
        ExportSession session = new ExportSession(writer, ExporterOptions.defaults());
        session.export(new AstFixtures().sampleUnit(MAIN));

        assertThatThrownBy(() -> session.export(new AstFixtures().sampleUnit(MAIN)))
                .isInstanceOf(IllegalStateException.class);
    }

    /**
     * {@code count} records, each holding a pointer to the next one (the last points back to
     * the first), and a function referencing their fields from 100 sites per record.
     */
    private TranslationUnitDecl recursiveRecords(int count) {
        AstFixtures fixtures = new AstFixtures();
        TranslationUnitDecl unit = fixtures.emptyUnit(MAIN);

        List<RecordDecl> records = new ArrayList<>();
        List<TagType> recordTypes = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String name = String.format("r%03d", i);
            RecordDecl record = RecordDecl.builder()
                    .kind(DeclKind.RECORD)
                    .id(fixtures.nextId())
                    .name(name)
                    .qualifiedName(name)
                    .completeDefinition(true)
                    .build();
            TagType type = TagType.builder()
                    .kind(TypeKind.RECORD)
                    .id(fixtures.nextId())
                    .spelling("struct " + name)
                    .decl(record)
                    .build();
            record.setTypeForDecl(type);
            records.add(record);
            recordTypes.add(type);
        }

        List<FieldDecl> fields = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            ChildType next = fixtures.pointerTo(recordTypes.get((i + 1) % count));
            String name = String.format("f%03d", i);
            FieldDecl field = FieldDecl.builder()
                    .kind(DeclKind.FIELD)
                    .id(fixtures.nextId())
                    .name(name)
                    .qualifiedName(records.get(i).getName() + "::" + name)
                    .type(QualType.of(next))
                    .build();
            records.get(i).getDecls().add(field);
            fields.add(field);
            unit.getTypes().add(recordTypes.get(i));
            unit.getTypes().add(next);
        }
        unit.getDecls().addAll(records);

        List<Stmt> sites = new ArrayList<>();
        for (int i = 0; i < 100 * count; i++) {
            FieldDecl target = fields.get(i % count);
            sites.add(DeclRefExpr.builder()
                    .kind(StmtKind.DECL_REF_EXPR)
                    .id(fixtures.nextId())
                    .type(target.getType())
                    .decl(target)
                    .build());
        }
        unit.getDecls().add(FunctionDecl.builder()
                .kind(DeclKind.FUNCTION)
                .id(fixtures.nextId())
                .name("use")
                .qualifiedName("use")
                .body(Stmt.builder().kind(StmtKind.COMPOUND_STMT).id(fixtures.nextId()).children(sites).build())
                .build());
        return unit;
    }

    private static VarDecl variable(AstFixtures fixtures, String name, BuiltinType type) {
        return VarDecl.builder()
                .kind(DeclKind.VAR)
                .id(fixtures.nextId())
                .name(name)
                .qualifiedName(name)
                .type(QualType.of(type))
                .build();
    }

    private JsonNode exportJson(TranslationUnitDecl unit, ExporterOptions options) throws IOException {
        return mapper.readTree(exportString(unit, options));
    }

    private static String exportString(TranslationUnitDecl unit, ExporterOptions options) throws IOException {
        return exportString(new AstExporter(options), unit);
    }

    private static String exportString(AstExporter exporter, TranslationUnitDecl unit) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        exporter.export(unit, out);
        return out.toString(StandardCharsets.UTF_8);
    }

    /**
     * First {@code ["name", [...]]} node in pre-order.
     */
    static void collectVariants(JsonNode node, String name, List<JsonNode> found) {
        if (node.isArray() && node.size() == 2 && node.get(0).isTextual()
                && node.get(0).asText().equals(name) && node.get(1).isArray()) {
            found.add(node);
        }
        for (JsonNode child : node) {
            collectVariants(child, name, found);
        }
    }

    static JsonNode findVariant(JsonNode node, String name) {
        if (node.isArray() && node.size() == 2 && node.get(0).isTextual()
                && node.get(0).asText().equals(name) && node.get(1).isArray()) {
            return node;
        }
        for (JsonNode child : node) {
            JsonNode found = findVariant(child, name);
            if (found != null) {
                return found;
            }
        }
        return null;
    }
}
