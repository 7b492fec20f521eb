package com.cfamily.astexport.export;

import com.cfamily.astexport.exception.ArityMismatchException;
import com.cfamily.astexport.model.NodeFamily;
import com.cfamily.astexport.model.NodeId;
import com.cfamily.astexport.model.QualType;
import com.cfamily.astexport.model.VariantNames;
import com.cfamily.astexport.model.decl.ObjCProtocolDecl;
import com.cfamily.astexport.model.type.BuiltinType;
import com.cfamily.astexport.model.type.ChildType;
import com.cfamily.astexport.model.type.ConstantArrayType;
import com.cfamily.astexport.model.type.FunctionType;
import com.cfamily.astexport.model.type.ObjCInterfaceType;
import com.cfamily.astexport.model.type.ObjCObjectType;
import com.cfamily.astexport.model.type.TagType;
import com.cfamily.astexport.model.type.Type;
import com.cfamily.astexport.model.type.TypeKind;
import com.cfamily.astexport.model.type.TypedefType;
import com.cfamily.astexport.model.type.VariableArrayType;
import com.cfamily.astexport.schema.KindHierarchy;
import com.cfamily.astexport.writer.AstWriter;
import com.cfamily.astexport.writer.Scope;

import java.io.IOException;
import java.util.List;

import static com.cfamily.astexport.export.CommonFieldEmitter.count;
import static com.cfamily.astexport.export.CommonFieldEmitter.nonNull;

/**
 * Defines the entries of a translation unit's type list. Types refer to other types and to
 * declarations by identity only.
 */
public class TypeEmitter {

    private final ExportSession session;

    TypeEmitter(ExportSession session) {
        this.session = session;
    }

    public void emit(Type type) throws IOException {
        Type t = type != null ? type : session.getSentinels().absentType();
        TypeKind kind = KindHierarchy.checkDispatchable(t.getKind(), t, NodeFamily.TYPE);
        session.getCounters().type();

        AstWriter w = writer();
        try (Scope v = w.openVariant(kind.getVariantName());
                Scope tuple = w.openTuple(KindHierarchy.tupleSize(kind))) {
            emitFields(kind, t);
        }
    }

    private void emitFields(TypeKind kind, Type t) throws IOException {
        if (kind.getParent() != null) {
            emitFields(kind.getParent(), t);
        }
        int emitted = emitOwnFields(kind, t);
        if (emitted != kind.getOwnFieldCount()) {
            throw new ArityMismatchException(kind.getVariantName() + " declares " + kind.getOwnFieldCount()
                    + " own fields but its emitter wrote " + emitted);
        }
    }

    private int emitOwnFields(TypeKind kind, Type t) throws IOException {
        AstWriter w = writer();
        return switch (kind) {
            case TYPE -> {
                emitTypeInfo(t);
                yield 1;
            }
            case BUILTIN -> {
                BuiltinType builtin = (BuiltinType) t;
                w.emitSimpleVariant(builtin.getBuiltinKind() == null
                        ? "Dependent"
                        : VariantNames.of(builtin.getBuiltinKind()));
                yield 1;
            }
            case POINTER, BLOCK_POINTER, MEMBER_POINTER, PAREN, DECLTYPE, ATOMIC, OBJC_OBJECT_POINTER,
                    REFERENCE, ARRAY, ADJUSTED -> {
                common().emitTypePointer(((ChildType) t).getChild());
                yield 1;
            }
            case CONSTANT_ARRAY -> {
                w.emitInteger(((ConstantArrayType) t).getSize());
                yield 1;
            }
            case VARIABLE_ARRAY -> {
                VariableArrayType vla = (VariableArrayType) t;
                common().emitPointer(vla.getSizeExpr() == null ? NodeId.ABSENT : vla.getSizeExpr().getId());
                yield 1;
            }
            case FUNCTION -> {
                emitFunctionTypeInfo((FunctionType) t);
                yield 1;
            }
            case FUNCTION_PROTO -> {
                emitParamsTypeInfo((FunctionType) t);
                yield 1;
            }
            case TYPEDEF -> {
                emitTypedefTypeInfo((TypedefType) t);
                yield 1;
            }
            case TAG -> {
                TagType tag = (TagType) t;
                common().emitPointer(tag.getDecl() == null ? NodeId.ABSENT : tag.getDecl().getId());
                yield 1;
            }
            case OBJC_OBJECT -> {
                emitObjCObjectTypeInfo((ObjCObjectType) t);
                yield 1;
            }
            case OBJC_INTERFACE -> {
                ObjCInterfaceType iface = (ObjCInterfaceType) t;
                common().emitPointer(iface.getDecl() == null ? NodeId.ABSENT : iface.getDecl().getId());
                yield 1;
            }
            case NONE, LVALUE_REFERENCE, RVALUE_REFERENCE, INCOMPLETE_ARRAY, DECAYED, FUNCTION_NO_PROTO,
                    RECORD, ENUM -> 0;
        };
    }

    /**
     * {@code {pointer, raw, ?desugared_type}}.
     */
    private void emitTypeInfo(Type t) throws IOException {
        AstWriter w = writer();
        boolean hasDesugared = t.getDesugared() != null;
        try (Scope o = w.openObject(2 + count(hasDesugared))) {
            w.emitTag("pointer");
            common().emitPointer(t.getId());
            w.emitTag("raw");
            w.emitString(t.getSpelling());
            if (hasDesugared) {
                w.emitTag("desugared_type");
                common().emitTypePointer(t.getDesugared());
            }
        }
    }

    private void emitFunctionTypeInfo(FunctionType t) throws IOException {
        AstWriter w = writer();
        try (Scope o = w.openObject(1)) {
            w.emitTag("return_type");
            common().emitQualType(t.getReturnType());
        }
    }

    private void emitParamsTypeInfo(FunctionType t) throws IOException {
        AstWriter w = writer();
        List<QualType> params = nonNull(t.getParamTypes());
        boolean hasParams = !params.isEmpty();
        try (Scope o = w.openObject(count(hasParams, t.isVariadic()))) {
            if (hasParams) {
                w.emitTag("params_type");
                try (Scope a = w.openArray(params.size())) {
                    for (QualType param : params) {
                        common().emitQualType(param);
                    }
                }
            }
            w.emitFlag("has_variadic_type", t.isVariadic());
        }
    }

    private void emitTypedefTypeInfo(TypedefType t) throws IOException {
        AstWriter w = writer();
        try (Scope o = w.openObject(2)) {
            w.emitTag("child_type");
            common().emitTypePointer(t.getChild());
            w.emitTag("decl_ptr");
            common().emitPointer(t.getDecl() == null ? NodeId.ABSENT : t.getDecl().getId());
        }
    }

    private void emitObjCObjectTypeInfo(ObjCObjectType t) throws IOException {
        AstWriter w = writer();
        List<ObjCProtocolDecl> protocols = nonNull(t.getProtocols());
        boolean hasProtocols = !protocols.isEmpty();
        try (Scope o = w.openObject(1 + count(hasProtocols))) {
            w.emitTag("base_type");
            common().emitTypePointer(t.getBaseType());
            if (hasProtocols) {
                w.emitTag("protocol_decls_ptr");
                try (Scope a = w.openArray(protocols.size())) {
                    for (ObjCProtocolDecl protocol : protocols) {
                        common().emitPointer(protocol.getId());
                    }
                }
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
