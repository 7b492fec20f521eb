package com.cfamily.astexport.export;

import com.cfamily.astexport.exception.UnknownKindException;
import com.cfamily.astexport.model.NodeFamily;
import com.cfamily.astexport.model.NodeId;
import com.cfamily.astexport.model.NodeKind;
import com.cfamily.astexport.model.comment.Comment;
import com.cfamily.astexport.model.comment.CommentKind;
import com.cfamily.astexport.model.decl.Decl;
import com.cfamily.astexport.model.decl.DeclKind;
import com.cfamily.astexport.model.decl.FunctionDecl;
import com.cfamily.astexport.model.decl.TranslationUnitDecl;
import com.cfamily.astexport.model.stmt.Stmt;
import com.cfamily.astexport.model.stmt.StmtKind;
import com.cfamily.astexport.model.type.Type;
import com.cfamily.astexport.model.type.TypeKind;
import com.cfamily.astexport.schema.KindHierarchy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.*;

/**
 * Emits one default-constructed node of every concrete kind and checks each written tuple
 * against the size the kind table declares.
 */
class ExhaustiveDispatchTest {

    private long nextAddress;

    @BeforeEach
    void setUp() {
        nextAddress = 0x1000;
    }

    @Test
    void testEveryConcreteKindWritesItsDeclaredTupleSize() throws Exception {
        TranslationUnitDecl unit = unitWithEveryKind();

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new AstExporter(ExporterOptions.defaults()).export(unit, out);
        JsonNode root = new ObjectMapper().readTree(out.toByteArray());

        Map<NodeFamily, Set<String>> seen = new HashMap<>();
        List<String> mismatches = new ArrayList<>();
        check(root, seen, mismatches);

        assertThat(mismatches).isEmpty();
        for (NodeFamily family : NodeFamily.values()) {
            Set<String> expected = new TreeSet<>();
            for (NodeKind kind : family.kinds()) {
                if (!kind.isAbstractKind()) {
                    expected.add(kind.getVariantName());
                }
            }
            assertThat(seen.getOrDefault(family, Set.of()))
                    .as("kinds written for %s", family)
                    .containsAll(expected);
        }
    }

    private TranslationUnitDecl unitWithEveryKind() throws ReflectiveOperationException {
        TranslationUnitDecl unit = TranslationUnitDecl.builder()
                .kind(DeclKind.TRANSLATION_UNIT)
                .id(nextId())
                .mainFile("/work/all.c")
                .build();

        List<Stmt> statements = new ArrayList<>();
        for (StmtKind kind : StmtKind.values()) {
            if (!kind.isAbstractKind()) {
                Stmt stmt = (Stmt) instantiate(kind);
                stmt.setKind(kind);
                stmt.setId(nextId());
                statements.add(stmt);
            }
        }
        Stmt body = Stmt.builder().kind(StmtKind.COMPOUND_STMT).id(nextId()).children(statements).build();

        List<Comment> comments = new ArrayList<>();
        for (CommentKind kind : CommentKind.values()) {
            if (!kind.isAbstractKind()) {
                Comment comment = (Comment) instantiate(kind);
                comment.setKind(kind);
                comment.setId(nextId());
                comments.add(comment);
            }
        }
        Comment fullComment = Comment.builder().kind(CommentKind.FULL_COMMENT).id(nextId()).children(comments).build();

        FunctionDecl holder = FunctionDecl.builder()
                .kind(DeclKind.FUNCTION)
                .id(nextId())
                .name("holder")
                .body(body)
                .fullComment(fullComment)
                .build();
        unit.getDecls().add(holder);

        for (DeclKind kind : DeclKind.values()) {
            if (!kind.isAbstractKind() && kind != DeclKind.TRANSLATION_UNIT) {
                Decl decl = (Decl) instantiate(kind);
                decl.setKind(kind);
                decl.setId(nextId());
                unit.getDecls().add(decl);
            }
        }

        for (TypeKind kind : TypeKind.values()) {
            if (!kind.isAbstractKind()) {
                Type type = (Type) instantiate(kind);
                type.setKind(kind);
                type.setId(nextId());
                unit.getTypes().add(type);
            }
        }
        return unit;
    }

    private static Object instantiate(NodeKind kind) throws ReflectiveOperationException {
        return kind.getNodeClass().getDeclaredConstructor().newInstance();
    }

    private NodeId nextId() {
        NodeId id = NodeId.of(nextAddress);
        nextAddress += 0x10;
        return id;
    }

    private static void check(JsonNode node, Map<NodeFamily, Set<String>> seen, List<String> mismatches) {
        if (node.isArray() && node.size() == 2 && node.get(0).isTextual() && node.get(1).isArray()) {
            String name = node.get(0).asText();
            NodeFamily family = familyOf(name);
            if (family != null) {
                seen.computeIfAbsent(family, f -> new TreeSet<>()).add(name);
                int expected = KindHierarchy.tupleSizeOf(family, name);
                if (node.get(1).size() != expected) {
                    mismatches.add(name + " wrote " + node.get(1).size() + " elements, expected " + expected);
                }
            }
        }
        for (JsonNode child : node) {
            check(child, seen, mismatches);
        }
    }

    private static NodeFamily familyOf(String variantName) {
        for (NodeFamily family : NodeFamily.values()) {
            try {
                KindHierarchy.resolve(family, variantName);
                return family;
            } catch (UnknownKindException e) {
                // not a kind of this family
            }
        }
        return null;
    }
}
