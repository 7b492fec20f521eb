package com.cfamily.astexport.model.decl;

import com.cfamily.astexport.model.NodeFamily;
import com.cfamily.astexport.model.NodeKind;
import lombok.Getter;

import java.util.List;

/**
 * Declaration kinds. Parents are declared before their children.
 */
@Getter
public enum DeclKind implements NodeKind {

    DECL(null, "Decl", true, Decl.class, "decl_info"),

    NAMED(DECL, "NamedDecl", true, NamedDecl.class, "named_decl_info"),
    TRANSLATION_UNIT(DECL, "TranslationUnitDecl", false, TranslationUnitDecl.class,
            "decl list", "decl_context_info", "c_type list"),
    LINKAGE_SPEC(DECL, "LinkageSpecDecl", false, LinkageSpecDecl.class, "decl list", "decl_context_info"),
    BLOCK(DECL, "BlockDecl", false, BlockDecl.class, "decl list", "decl_context_info", "block_decl_info"),
    FILE_SCOPE_ASM(DECL, "FileScopeAsmDecl", false, FileScopeAsmDecl.class, "string"),
    ACCESS_SPEC(DECL, "AccessSpecDecl", false, AccessSpecDecl.class, "access_specifier"),
    EMPTY(DECL, "EmptyDecl", false, EmptyDecl.class),

    VALUE(NAMED, "ValueDecl", true, ValueDecl.class, "qual_type"),
    TYPE(NAMED, "TypeDecl", true, TypeDecl.class, "opt_type", "type_ptr"),
    NAMESPACE(NAMED, "NamespaceDecl", false, NamespaceDecl.class,
            "decl list", "decl_context_info", "namespace_decl_info"),
    LABEL(NAMED, "LabelDecl", false, LabelDecl.class),
    OBJC_METHOD(NAMED, "ObjCMethodDecl", false, ObjCMethodDecl.class, "obj_c_method_decl_info"),
    OBJC_CONTAINER(NAMED, "ObjCContainerDecl", true, ObjCContainerDecl.class, "decl list", "decl_context_info"),

    DECLARATOR(VALUE, "DeclaratorDecl", true, DeclaratorDecl.class),
    ENUM_CONSTANT(VALUE, "EnumConstantDecl", false, EnumConstantDecl.class, "enum_constant_decl_info"),
    INDIRECT_FIELD(VALUE, "IndirectFieldDecl", false, IndirectFieldDecl.class, "decl_ref list"),

    FUNCTION(DECLARATOR, "FunctionDecl", false, FunctionDecl.class, "function_decl_info"),
    CXX_METHOD(FUNCTION, "CXXMethodDecl", false, FunctionDecl.class),
    CXX_CONSTRUCTOR(CXX_METHOD, "CXXConstructorDecl", false, FunctionDecl.class),
    CXX_DESTRUCTOR(CXX_METHOD, "CXXDestructorDecl", false, FunctionDecl.class),
    FIELD(DECLARATOR, "FieldDecl", false, FieldDecl.class, "field_decl_info"),
    OBJC_IVAR(FIELD, "ObjCIvarDecl", false, FieldDecl.class),
    VAR(DECLARATOR, "VarDecl", false, VarDecl.class, "var_decl_info"),
    PARM_VAR(VAR, "ParmVarDecl", false, VarDecl.class),

    TYPEDEF_NAME(TYPE, "TypedefNameDecl", true, TypedefNameDecl.class),
    TYPEDEF(TYPEDEF_NAME, "TypedefDecl", false, TypedefNameDecl.class, "typedef_decl_info"),
    TYPE_ALIAS(TYPEDEF_NAME, "TypeAliasDecl", false, TypedefNameDecl.class),
    TAG(TYPE, "TagDecl", true, TagDecl.class, "decl list", "decl_context_info"),
    ENUM(TAG, "EnumDecl", false, EnumDecl.class, "enum_decl_info"),
    RECORD(TAG, "RecordDecl", false, RecordDecl.class, "record_decl_info"),
    CXX_RECORD(RECORD, "CXXRecordDecl", false, CxxRecordDecl.class, "cxx_record_decl_info"),

    OBJC_INTERFACE(OBJC_CONTAINER, "ObjCInterfaceDecl", false, ObjCInterfaceDecl.class, "obj_c_interface_decl_info"),
    OBJC_PROTOCOL(OBJC_CONTAINER, "ObjCProtocolDecl", false, ObjCProtocolDecl.class, "obj_c_protocol_decl_info");

    private final DeclKind parent;
    private final String variantName;
    private final boolean abstractKind;
    private final Class<? extends Decl> nodeClass;
    private final List<String> ownFields;

    DeclKind(DeclKind parent, String variantName, boolean abstractKind, Class<? extends Decl> nodeClass,
            String... ownFields) {
        this.parent = parent;
        this.variantName = variantName;
        this.abstractKind = abstractKind;
        this.nodeClass = nodeClass;
        this.ownFields = List.of(ownFields);
    }

    @Override
    public NodeFamily getFamily() {
        return NodeFamily.DECL;
    }
}
