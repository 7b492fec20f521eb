package com.cfamily.astexport.export;

import com.cfamily.astexport.exception.UnknownKindException;
import com.cfamily.astexport.model.Attribute;
import com.cfamily.astexport.model.NodeId;
import com.cfamily.astexport.model.QualType;
import com.cfamily.astexport.model.SourceRange;
import com.cfamily.astexport.model.decl.Decl;
import com.cfamily.astexport.model.decl.DeclKind;
import com.cfamily.astexport.model.decl.NamedDecl;
import com.cfamily.astexport.model.decl.ValueDecl;
import com.cfamily.astexport.model.stmt.LabelStmt;
import com.cfamily.astexport.model.type.Type;
import com.cfamily.astexport.writer.AstWriter;
import com.cfamily.astexport.writer.Scope;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fields shared by several families: identities, source ranges, qualified types,
 * declaration reference digests and attributes.
 * <p>
 * Everything written here is a reference. Nothing recurses into another node's
 * definition, which keeps output linear in the number of distinct nodes.
 */
public class CommonFieldEmitter {

    private final ExportSession session;

    CommonFieldEmitter(ExportSession session) {
        this.session = session;
    }

    /**
     * Number of {@code true} values; used to size objects with optional fields and flags.
     */
    static int count(boolean... present) {
        int n = 0;
        for (boolean p : present) {
            if (p) {
                n++;
            }
        }
        return n;
    }

    static <T> List<T> nonNull(List<T> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }

    static <T> List<T> orEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }

    public void emitPointer(NodeId id) throws IOException {
        writer().emitString(session.getIdentities().encode(id));
    }

    public void emitTypePointer(Type type) throws IOException {
        if (type == null) {
            emitPointer(NodeId.ABSENT);
            return;
        }
        if (!session.getTypeArena().contains(type.getId())) {
            session.getCounters().danglingTypeReference();
        }
        emitPointer(type.getId());
    }

    public void emitRange(SourceRange range) throws IOException {
        session.getLocations().emitRange(writer(), range);
    }

    public void emitStringList(List<String> values) throws IOException {
        List<String> items = orEmpty(values);
        AstWriter w = writer();
        try (Scope a = w.openArray(items.size())) {
            for (String value : items) {
                w.emitString(value);
            }
        }
    }

    /**
     * {@code {name, qual_name}}; the qualified name is written innermost component first.
     */
    public void emitNamedDeclInfo(NamedDecl decl) throws IOException {
        AstWriter w = writer();
        String name = decl.getName() == null ? "" : decl.getName();
        List<String> qualName = new ArrayList<>();
        if (decl.getQualifiedName() != null && !decl.getQualifiedName().isEmpty()) {
            qualName.addAll(List.of(decl.getQualifiedName().split("::")));
            Collections.reverse(qualName);
        } else {
            qualName.add(name);
        }
        try (Scope o = w.openObject(2)) {
            w.emitTag("name");
            w.emitString(name);
            w.emitTag("qual_name");
            emitStringList(qualName);
        }
    }

    /**
     * {@code {raw, ?desugared, type_ptr, ~is_const, ~is_restrict, ~is_volatile}}.
     * An absent qualified type refers to the absent type.
     */
    public void emitQualType(QualType qualType) throws IOException {
        AstWriter w = writer();
        if (qualType == null) {
            try (Scope o = w.openObject(2)) {
                w.emitTag("raw");
                w.emitString("");
                w.emitTag("type_ptr");
                emitTypePointer(null);
            }
            return;
        }
        String raw = qualType.getSpelling() == null ? "" : qualType.getSpelling();
        boolean hasDesugared = qualType.getDesugaredSpelling() != null
                && !qualType.getDesugaredSpelling().equals(raw);
        int fields = 2 + count(hasDesugared, qualType.isConstQualified(), qualType.isRestrictQualified(),
                qualType.isVolatileQualified());

        try (Scope o = w.openObject(fields)) {
            w.emitTag("raw");
            w.emitString(raw);
            if (hasDesugared) {
                w.emitTag("desugared");
                w.emitString(qualType.getDesugaredSpelling());
            }
            w.emitTag("type_ptr");
            emitTypePointer(qualType.getType());
            w.emitFlag("is_const", qualType.isConstQualified());
            w.emitFlag("is_restrict", qualType.isRestrictQualified());
            w.emitFlag("is_volatile", qualType.isVolatileQualified());
        }
    }

    /**
     * Reference digest {@code {kind, decl_pointer, ?name, ~is_hidden, ?qual_type}}.
     * An absent target refers to the declaration sentinel.
     */
    public void emitDeclRef(Decl target) throws IOException {
        AstWriter w = writer();
        Decl decl = target != null ? target : session.getSentinels().decl();
        DeclKind kind = decl.getKind();
        if (kind == null) {
            throw new UnknownKindException("Referenced declaration " + decl.getId() + " has no kind");
        }
        NamedDecl named = decl instanceof NamedDecl nd ? nd : null;
        QualType type = decl instanceof ValueDecl vd ? vd.getType() : null;
        int fields = 2 + count(named != null, decl.isHidden(), type != null);

        try (Scope o = w.openObject(fields)) {
            w.emitTag("kind");
            w.emitSimpleVariant(referenceKindName(kind));
            w.emitTag("decl_pointer");
            emitPointer(decl.getId());
            if (named != null) {
                w.emitTag("name");
                emitNamedDeclInfo(named);
            }
            w.emitFlag("is_hidden", decl.isHidden());
            if (type != null) {
                w.emitTag("qual_type");
                emitQualType(type);
            }
        }
    }

    public void emitDeclRefList(List<? extends Decl> targets) throws IOException {
        List<? extends Decl> items = orEmpty(targets);
        try (Scope a = writer().openArray(items.size())) {
            for (Decl target : items) {
                emitDeclRef(target);
            }
        }
    }

    /**
     * {@code {label, pointer}} for gotos and label addresses.
     */
    public void emitLabelRef(LabelStmt label) throws IOException {
        AstWriter w = writer();
        try (Scope o = w.openObject(2)) {
            w.emitTag("label");
            w.emitString(label == null ? "" : label.getName());
            w.emitTag("pointer");
            emitPointer(label == null ? NodeId.ABSENT : label.getId());
        }
    }

    /**
     * Attribute list; each entry is a variant named {@code <Name>Attr} carrying
     * {@code {pointer, source_range, parameters, ~is_inherited, ~is_implicit}}.
     */
    public void emitAttributes(List<Attribute> attributes) throws IOException {
        AstWriter w = writer();
        List<Attribute> items = nonNull(attributes);
        try (Scope a = w.openArray(items.size())) {
            for (Attribute attribute : items) {
                int fields = 3 + count(attribute.isInherited(), attribute.isImplicit());
                try (Scope v = w.openVariant(attribute.getName() + "Attr");
                        Scope o = w.openObject(fields)) {
                    w.emitTag("pointer");
                    emitPointer(attribute.getId());
                    w.emitTag("source_range");
                    emitRange(attribute.getRange());
                    w.emitTag("parameters");
                    emitStringList(attribute.getParameters());
                    w.emitFlag("is_inherited", attribute.isInherited());
                    w.emitFlag("is_implicit", attribute.isImplicit());
                }
            }
        }
    }

    private static String referenceKindName(DeclKind kind) {
        String name = kind.getVariantName();
        return name.endsWith("Decl") ? name.substring(0, name.length() - "Decl".length()) : name;
    }

    private AstWriter writer() {
        return session.getWriter();
    }
}
