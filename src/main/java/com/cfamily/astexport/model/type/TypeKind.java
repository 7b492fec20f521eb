package com.cfamily.astexport.model.type;

import com.cfamily.astexport.model.NodeFamily;
import com.cfamily.astexport.model.NodeKind;
import lombok.Getter;

import java.util.List;

/**
 * Type kinds. {@link #NONE} is the absent-type variant.
 */
@Getter
public enum TypeKind implements NodeKind {

    TYPE(null, "Type", true, Type.class, "type_info"),

    NONE(TYPE, "NoneType", false, Type.class),
    BUILTIN(TYPE, "BuiltinType", false, BuiltinType.class, "builtin_type_kind"),
    POINTER(TYPE, "PointerType", false, ChildType.class, "type_ptr"),
    BLOCK_POINTER(TYPE, "BlockPointerType", false, ChildType.class, "type_ptr"),
    MEMBER_POINTER(TYPE, "MemberPointerType", false, ChildType.class, "type_ptr"),
    PAREN(TYPE, "ParenType", false, ChildType.class, "type_ptr"),
    DECLTYPE(TYPE, "DecltypeType", false, ChildType.class, "type_ptr"),
    ATOMIC(TYPE, "AtomicType", false, ChildType.class, "type_ptr"),
    OBJC_OBJECT_POINTER(TYPE, "ObjCObjectPointerType", false, ChildType.class, "type_ptr"),
    REFERENCE(TYPE, "ReferenceType", true, ChildType.class, "type_ptr"),
    LVALUE_REFERENCE(REFERENCE, "LValueReferenceType", false, ChildType.class),
    RVALUE_REFERENCE(REFERENCE, "RValueReferenceType", false, ChildType.class),
    ARRAY(TYPE, "ArrayType", true, ChildType.class, "type_ptr"),
    CONSTANT_ARRAY(ARRAY, "ConstantArrayType", false, ConstantArrayType.class, "int"),
    INCOMPLETE_ARRAY(ARRAY, "IncompleteArrayType", false, ChildType.class),
    VARIABLE_ARRAY(ARRAY, "VariableArrayType", false, VariableArrayType.class, "pointer"),
    ADJUSTED(TYPE, "AdjustedType", false, ChildType.class, "type_ptr"),
    DECAYED(ADJUSTED, "DecayedType", false, ChildType.class),
    FUNCTION(TYPE, "FunctionType", true, FunctionType.class, "function_type_info"),
    FUNCTION_PROTO(FUNCTION, "FunctionProtoType", false, FunctionType.class, "params_type_info"),
    FUNCTION_NO_PROTO(FUNCTION, "FunctionNoProtoType", false, FunctionType.class),
    TYPEDEF(TYPE, "TypedefType", false, TypedefType.class, "typedef_type_info"),
    TAG(TYPE, "TagType", true, TagType.class, "pointer"),
    RECORD(TAG, "RecordType", false, TagType.class),
    ENUM(TAG, "EnumType", false, TagType.class),
    OBJC_OBJECT(TYPE, "ObjCObjectType", false, ObjCObjectType.class, "objc_object_type_info"),
    OBJC_INTERFACE(OBJC_OBJECT, "ObjCInterfaceType", false, ObjCInterfaceType.class, "pointer");

    private final TypeKind parent;
    private final String variantName;
    private final boolean abstractKind;
    private final Class<? extends Type> nodeClass;
    private final List<String> ownFields;

    TypeKind(TypeKind parent, String variantName, boolean abstractKind, Class<? extends Type> nodeClass,
            String... ownFields) {
        this.parent = parent;
        this.variantName = variantName;
        this.abstractKind = abstractKind;
        this.nodeClass = nodeClass;
        this.ownFields = List.of(ownFields);
    }

    @Override
    public NodeFamily getFamily() {
        return NodeFamily.TYPE;
    }
}
