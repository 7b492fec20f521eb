package com.cfamily.astexport.export;

import com.cfamily.astexport.exception.ArityMismatchException;
import com.cfamily.astexport.model.BaseSpecifier;
import com.cfamily.astexport.model.NodeFamily;
import com.cfamily.astexport.model.VariantNames;
import com.cfamily.astexport.model.decl.AccessSpecDecl;
import com.cfamily.astexport.model.decl.AccessSpecifier;
import com.cfamily.astexport.model.decl.BlockCapture;
import com.cfamily.astexport.model.decl.BlockDecl;
import com.cfamily.astexport.model.decl.CxxRecordDecl;
import com.cfamily.astexport.model.decl.Decl;
import com.cfamily.astexport.model.decl.DeclContext;
import com.cfamily.astexport.model.decl.DeclKind;
import com.cfamily.astexport.model.decl.EnumConstantDecl;
import com.cfamily.astexport.model.decl.EnumDecl;
import com.cfamily.astexport.model.decl.FieldDecl;
import com.cfamily.astexport.model.decl.FileScopeAsmDecl;
import com.cfamily.astexport.model.decl.FunctionDecl;
import com.cfamily.astexport.model.decl.IndirectFieldDecl;
import com.cfamily.astexport.model.decl.NamedDecl;
import com.cfamily.astexport.model.decl.NamespaceDecl;
import com.cfamily.astexport.model.decl.ObjCContainerDecl;
import com.cfamily.astexport.model.decl.ObjCInterfaceDecl;
import com.cfamily.astexport.model.decl.ObjCMethodDecl;
import com.cfamily.astexport.model.decl.PreviousDecl;
import com.cfamily.astexport.model.decl.RecordDecl;
import com.cfamily.astexport.model.decl.StorageClass;
import com.cfamily.astexport.model.decl.TlsKind;
import com.cfamily.astexport.model.decl.TranslationUnitDecl;
import com.cfamily.astexport.model.decl.TypeDecl;
import com.cfamily.astexport.model.decl.TypedefNameDecl;
import com.cfamily.astexport.model.decl.ValueDecl;
import com.cfamily.astexport.model.decl.VarDecl;
import com.cfamily.astexport.model.type.Type;
import com.cfamily.astexport.schema.KindHierarchy;
import com.cfamily.astexport.writer.AstWriter;
import com.cfamily.astexport.writer.Scope;

import java.io.IOException;
import java.util.List;

import static com.cfamily.astexport.export.CommonFieldEmitter.count;
import static com.cfamily.astexport.export.CommonFieldEmitter.nonNull;
import static com.cfamily.astexport.export.CommonFieldEmitter.orEmpty;

/**
 * Defines declarations at their lexical position.
 * <p>
 * A declaration is written as {@code Variant(<Kind>Decl)} holding a tuple whose size is
 * {@link KindHierarchy#tupleSize}; the tuple carries the fields of every ancestor kind,
 * root first, then the kind's own.
 */
public class DeclEmitter {

    private final ExportSession session;

    DeclEmitter(ExportSession session) {
        this.session = session;
    }

    public void emit(Decl decl) throws IOException {
        Decl d = decl != null ? decl : session.getSentinels().decl();
        DeclKind kind = KindHierarchy.checkDispatchable(d.getKind(), d, NodeFamily.DECL);
        session.getCounters().declaration(d == session.getSentinels().decl());

        AstWriter w = writer();
        try (Scope v = w.openVariant(kind.getVariantName());
                Scope t = w.openTuple(KindHierarchy.tupleSize(kind))) {
            emitFields(kind, d);
        }
    }

    /**
     * Definitional list; absent entries become the declaration sentinel.
     */
    public void emitList(List<? extends Decl> decls) throws IOException {
        List<? extends Decl> items = orEmpty(decls);
        try (Scope a = writer().openArray(items.size())) {
            for (Decl item : items) {
                emit(item);
            }
        }
    }

    private void emitFields(DeclKind kind, Decl d) throws IOException {
        if (kind.getParent() != null) {
            emitFields(kind.getParent(), d);
        }
        int emitted = emitOwnFields(kind, d);
        if (emitted != kind.getOwnFieldCount()) {
            throw new ArityMismatchException(kind.getVariantName() + " declares " + kind.getOwnFieldCount()
                    + " own fields but its emitter wrote " + emitted);
        }
    }

    private int emitOwnFields(DeclKind kind, Decl d) throws IOException {
        return switch (kind) {
            case DECL -> {
                emitDeclInfo(d);
                yield 1;
            }
            case NAMED -> {
                common().emitNamedDeclInfo((NamedDecl) d);
                yield 1;
            }
            case VALUE -> {
                common().emitQualType(((ValueDecl) d).getType());
                yield 1;
            }
            case TYPE -> {
                emitTypeDeclFields((TypeDecl) d);
                yield 2;
            }
            case TRANSLATION_UNIT -> {
                emitDeclContext((TranslationUnitDecl) d);
                emitTypeList();
                yield 3;
            }
            case LINKAGE_SPEC, TAG, OBJC_CONTAINER -> {
                emitDeclContext((DeclContext) d);
                yield 2;
            }
            case NAMESPACE -> {
                NamespaceDecl ns = (NamespaceDecl) d;
                emitDeclContext(ns);
                emitNamespaceDeclInfo(ns);
                yield 3;
            }
            case BLOCK -> {
                BlockDecl block = (BlockDecl) d;
                emitDeclContext(block);
                emitBlockDeclInfo(block);
                yield 3;
            }
            case FILE_SCOPE_ASM -> {
                writer().emitString(((FileScopeAsmDecl) d).getAsmString());
                yield 1;
            }
            case ACCESS_SPEC -> {
                AccessSpecifier access = ((AccessSpecDecl) d).getAccess();
                writer().emitSimpleVariant(VariantNames.of(access == null ? AccessSpecifier.NONE : access));
                yield 1;
            }
            case OBJC_METHOD -> {
                emitObjCMethodDeclInfo((ObjCMethodDecl) d);
                yield 1;
            }
            case ENUM_CONSTANT -> {
                emitEnumConstantDeclInfo((EnumConstantDecl) d);
                yield 1;
            }
            case INDIRECT_FIELD -> {
                common().emitDeclRefList(((IndirectFieldDecl) d).getChain());
                yield 1;
            }
            case FUNCTION -> {
                emitFunctionDeclInfo((FunctionDecl) d);
                yield 1;
            }
            case FIELD -> {
                emitFieldDeclInfo((FieldDecl) d);
                yield 1;
            }
            case VAR -> {
                emitVarDeclInfo((VarDecl) d);
                yield 1;
            }
            case TYPEDEF -> {
                emitTypedefDeclInfo((TypedefNameDecl) d);
                yield 1;
            }
            case ENUM -> {
                emitEnumDeclInfo((EnumDecl) d);
                yield 1;
            }
            case RECORD -> {
                emitRecordDeclInfo((RecordDecl) d);
                yield 1;
            }
            case CXX_RECORD -> {
                emitCxxRecordDeclInfo((CxxRecordDecl) d);
                yield 1;
            }
            case OBJC_INTERFACE -> {
                emitObjCInterfaceDeclInfo((ObjCInterfaceDecl) d);
                yield 1;
            }
            case OBJC_PROTOCOL -> {
                emitProtocols((ObjCContainerDecl) d);
                yield 1;
            }
            case DECLARATOR, CXX_METHOD, CXX_CONSTRUCTOR, CXX_DESTRUCTOR, OBJC_IVAR, PARM_VAR,
                    TYPEDEF_NAME, TYPE_ALIAS, LABEL, EMPTY -> 0;
        };
    }

    /**
     * {@code {pointer, ?parent_pointer, ?previous_decl, source_range, ?owning_module,
     * flags, attributes, ?full_comment}}.
     */
    private void emitDeclInfo(Decl d) throws IOException {
        AstWriter w = writer();
        DeclContext semantic = d.getSemanticContext();
        DeclContext lexical = d.getLexicalContext();
        boolean hasParent = semantic != null && lexical != null && semantic != lexical;
        PreviousDecl previous = d.getPreviousDecl();
        boolean hasPrevious = previous != null && previous.getTarget() != null;
        boolean hasModule = d.getOwningModule() != null && !d.getOwningModule().isEmpty();
        boolean hasComment = d.getFullComment() != null;

        int fields = 3 + count(hasParent, hasPrevious, hasModule, d.isHidden(), d.isImplicit(), d.isUsed(),
                d.isReferenced(), d.isInvalid(), hasComment);

        try (Scope o = w.openObject(fields)) {
            w.emitTag("pointer");
            common().emitPointer(d.getId());
            if (hasParent) {
                w.emitTag("parent_pointer");
                common().emitPointer(semantic.getId());
            }
            if (hasPrevious) {
                w.emitTag("previous_decl");
                String tag = previous.getKind() == PreviousDecl.Kind.FIRST ? "First" : "Previous";
                try (Scope v = w.openVariant(tag)) {
                    common().emitPointer(previous.getTarget().getId());
                }
            }
            w.emitTag("source_range");
            common().emitRange(d.getRange());
            if (hasModule) {
                w.emitTag("owning_module");
                w.emitString(d.getOwningModule());
            }
            w.emitFlag("is_hidden", d.isHidden());
            w.emitFlag("is_implicit", d.isImplicit());
            w.emitFlag("is_used", d.isUsed());
            w.emitFlag("is_this_declaration_referenced", d.isReferenced());
            w.emitFlag("is_invalid_decl", d.isInvalid());
            w.emitTag("attributes");
            common().emitAttributes(d.getAttributes());
            if (hasComment) {
                w.emitTag("full_comment");
                session.getComments().emit(d.getFullComment());
            }
        }
    }

    /**
     * Two tuple elements: the context's declarations after deduplication, then
     * {@code {~has_external_lexical_storage, ~has_external_visible_storage}}.
     */
    private void emitDeclContext(DeclContext context) throws IOException {
        AstWriter w = writer();
        emitList(session.declsToEmit(context.getDecls()));
        int fields = count(context.isExternalLexicalStorage(), context.isExternalVisibleStorage());
        try (Scope o = w.openObject(fields)) {
            w.emitFlag("has_external_lexical_storage", context.isExternalLexicalStorage());
            w.emitFlag("has_external_visible_storage", context.isExternalVisibleStorage());
        }
    }

    private void emitTypeList() throws IOException {
        List<Type> types = session.getTypeArena().getTypes();
        try (Scope a = writer().openArray(types.size())) {
            for (Type type : types) {
                session.getTypes().emit(type);
            }
        }
    }

    /**
     * {@code opt_type} is {@code Type(raw)} or {@code NoType}; {@code type_ptr} follows.
     */
    private void emitTypeDeclFields(TypeDecl d) throws IOException {
        AstWriter w = writer();
        Type type = d.getTypeForDecl();
        if (type == null) {
            w.emitSimpleVariant("NoType");
        } else {
            try (Scope v = w.openVariant("Type")) {
                w.emitString(type.getSpelling());
            }
        }
        common().emitTypePointer(type);
    }

    private void emitNamespaceDeclInfo(NamespaceDecl ns) throws IOException {
        AstWriter w = writer();
        boolean hasOriginal = ns.getOriginalNamespace() != null && ns.getOriginalNamespace() != ns;
        try (Scope o = w.openObject(count(ns.isInline(), hasOriginal))) {
            w.emitFlag("is_inline", ns.isInline());
            if (hasOriginal) {
                w.emitTag("original_namespace");
                common().emitDeclRef(ns.getOriginalNamespace());
            }
        }
    }

    private void emitBlockDeclInfo(BlockDecl block) throws IOException {
        AstWriter w = writer();
        List<VarDecl> parameters = orEmpty(block.getParameters());
        List<BlockCapture> captures = nonNull(block.getCaptures());
        boolean hasParameters = !parameters.isEmpty();
        boolean hasCaptures = !captures.isEmpty();
        boolean hasBody = block.getBody() != null;

        int fields = count(hasParameters, block.isVariadic(), block.isCapturesCxxThis(), hasCaptures, hasBody);
        try (Scope o = w.openObject(fields)) {
            if (hasParameters) {
                w.emitTag("parameters");
                emitList(parameters);
            }
            w.emitFlag("is_variadic", block.isVariadic());
            w.emitFlag("captures_cxx_this", block.isCapturesCxxThis());
            if (hasCaptures) {
                w.emitTag("captured_variables");
                try (Scope a = w.openArray(captures.size())) {
                    for (BlockCapture capture : captures) {
                        emitBlockCapture(capture);
                    }
                }
            }
            if (hasBody) {
                w.emitTag("body");
                session.getStmts().emit(block.getBody());
            }
        }
    }

    private void emitBlockCapture(BlockCapture capture) throws IOException {
        AstWriter w = writer();
        boolean hasVariable = capture.getVariable() != null;
        boolean hasCopy = capture.getCopyExpr() != null;
        try (Scope o = w.openObject(count(capture.isByRef(), capture.isNested(), hasVariable, hasCopy))) {
            w.emitFlag("is_by_ref", capture.isByRef());
            w.emitFlag("is_nested", capture.isNested());
            if (hasVariable) {
                w.emitTag("variable");
                common().emitDeclRef(capture.getVariable());
            }
            if (hasCopy) {
                w.emitTag("copy_expr");
                session.getStmts().emit(capture.getCopyExpr());
            }
        }
    }

    private void emitObjCMethodDeclInfo(ObjCMethodDecl method) throws IOException {
        AstWriter w = writer();
        List<VarDecl> parameters = orEmpty(method.getParameters());
        boolean hasParameters = !parameters.isEmpty();
        boolean hasBody = method.getBody() != null;
        try (Scope o = w.openObject(1 + count(method.isInstanceMethod(), hasParameters, hasBody))) {
            w.emitFlag("is_instance_method", method.isInstanceMethod());
            w.emitTag("result_type");
            common().emitQualType(method.getResultType());
            if (hasParameters) {
                w.emitTag("parameters");
                emitList(parameters);
            }
            if (hasBody) {
                w.emitTag("body");
                session.getStmts().emit(method.getBody());
            }
        }
    }

    private void emitEnumConstantDeclInfo(EnumConstantDecl constant) throws IOException {
        AstWriter w = writer();
        boolean hasInit = constant.getInit() != null;
        try (Scope o = w.openObject(count(hasInit))) {
            if (hasInit) {
                w.emitTag("init_expr");
                session.getStmts().emit(constant.getInit());
            }
        }
    }

    /**
     * {@code {?storage_class, ~is_inline, ~is_virtual, ~is_pure, ~is_deleted, ?parameters,
     * ?decl_ptr_with_body, ?body}}.
     */
    private void emitFunctionDeclInfo(FunctionDecl function) throws IOException {
        AstWriter w = writer();
        boolean hasStorage = hasStorageClass(function.getStorageClass());
        List<VarDecl> parameters = orEmpty(function.getParameters());
        boolean hasParameters = !parameters.isEmpty();
        boolean hasDeclWithBody = function.getDeclWithBody() != null;
        boolean hasBody = function.getBody() != null;

        int fields = count(hasStorage, function.isInlineSpecified(), function.isVirtualAsWritten(),
                function.isPure(), function.isDeletedAsWritten(), hasParameters, hasDeclWithBody, hasBody);
        try (Scope o = w.openObject(fields)) {
            if (hasStorage) {
                w.emitTag("storage_class");
                w.emitSimpleVariant(VariantNames.of(function.getStorageClass()));
            }
            w.emitFlag("is_inline", function.isInlineSpecified());
            w.emitFlag("is_virtual", function.isVirtualAsWritten());
            w.emitFlag("is_pure", function.isPure());
            w.emitFlag("is_deleted", function.isDeletedAsWritten());
            if (hasParameters) {
                w.emitTag("parameters");
                emitList(parameters);
            }
            if (hasDeclWithBody) {
                w.emitTag("decl_ptr_with_body");
                common().emitPointer(function.getDeclWithBody().getId());
            }
            if (hasBody) {
                w.emitTag("body");
                session.getStmts().emit(function.getBody());
            }
        }
    }

    private void emitFieldDeclInfo(FieldDecl field) throws IOException {
        AstWriter w = writer();
        boolean hasInit = field.getInit() != null;
        boolean hasBitWidth = field.getBitWidth() != null;
        try (Scope o = w.openObject(count(field.isMutable(), field.isModulePrivate(), hasInit, hasBitWidth))) {
            w.emitFlag("is_mutable", field.isMutable());
            w.emitFlag("is_module_private", field.isModulePrivate());
            if (hasInit) {
                w.emitTag("init_expr");
                session.getStmts().emit(field.getInit());
            }
            if (hasBitWidth) {
                w.emitTag("bit_width_expr");
                session.getStmts().emit(field.getBitWidth());
            }
        }
    }

    /**
     * {@code {?storage_class, ?tls_kind, ~is_global, ~is_static_local, ~is_module_private,
     * ~is_nrvo_variable, ?init_expr}}.
     */
    private void emitVarDeclInfo(VarDecl var) throws IOException {
        AstWriter w = writer();
        boolean hasStorage = hasStorageClass(var.getStorageClass());
        boolean hasTls = var.getTlsKind() != null && var.getTlsKind() != TlsKind.NONE;
        boolean hasInit = var.getInit() != null;

        int fields = count(hasStorage, hasTls, var.isGlobal(), var.isStaticLocal(), var.isModulePrivate(),
                var.isNrvoVariable(), hasInit);
        try (Scope o = w.openObject(fields)) {
            if (hasStorage) {
                w.emitTag("storage_class");
                w.emitSimpleVariant(VariantNames.of(var.getStorageClass()));
            }
            if (hasTls) {
                w.emitTag("tls_kind");
                w.emitSimpleVariant(VariantNames.of(var.getTlsKind()));
            }
            w.emitFlag("is_global", var.isGlobal());
            w.emitFlag("is_static_local", var.isStaticLocal());
            w.emitFlag("is_module_private", var.isModulePrivate());
            w.emitFlag("is_nrvo_variable", var.isNrvoVariable());
            if (hasInit) {
                w.emitTag("init_expr");
                session.getStmts().emit(var.getInit());
            }
        }
    }

    private void emitTypedefDeclInfo(TypedefNameDecl typedef) throws IOException {
        AstWriter w = writer();
        try (Scope o = w.openObject(count(typedef.isModulePrivate()))) {
            w.emitFlag("is_module_private", typedef.isModulePrivate());
        }
    }

    private void emitEnumDeclInfo(EnumDecl decl) throws IOException {
        AstWriter w = writer();
        boolean hasScope = decl.getScope() != null;
        try (Scope o = w.openObject(count(hasScope, decl.isModulePrivate()))) {
            if (hasScope) {
                w.emitTag("scope");
                w.emitSimpleVariant(VariantNames.of(decl.getScope()));
            }
            w.emitFlag("is_module_private", decl.isModulePrivate());
        }
    }

    private void emitRecordDeclInfo(RecordDecl record) throws IOException {
        AstWriter w = writer();
        try (Scope o = w.openObject(count(record.isModulePrivate(), record.isCompleteDefinition()))) {
            w.emitFlag("is_module_private", record.isModulePrivate());
            w.emitFlag("is_complete_definition", record.isCompleteDefinition());
        }
    }

    /**
     * {@code {?bases, ?vbases, ~is_c_like}}; bases are type references.
     */
    private void emitCxxRecordDeclInfo(CxxRecordDecl record) throws IOException {
        AstWriter w = writer();
        List<BaseSpecifier> bases = nonNull(record.getBases());
        List<BaseSpecifier> virtualBases = nonNull(record.getVirtualBases());
        boolean hasBases = !bases.isEmpty();
        boolean hasVirtualBases = !virtualBases.isEmpty();
        try (Scope o = w.openObject(count(hasBases, hasVirtualBases, record.isCLike()))) {
            if (hasBases) {
                w.emitTag("bases");
                emitBaseTypes(bases);
            }
            if (hasVirtualBases) {
                w.emitTag("vbases");
                emitBaseTypes(virtualBases);
            }
            w.emitFlag("is_c_like", record.isCLike());
        }
    }

    private void emitBaseTypes(List<BaseSpecifier> bases) throws IOException {
        try (Scope a = writer().openArray(bases.size())) {
            for (BaseSpecifier base : bases) {
                common().emitTypePointer(base.getType());
            }
        }
    }

    private void emitObjCInterfaceDeclInfo(ObjCInterfaceDecl decl) throws IOException {
        AstWriter w = writer();
        boolean hasSuper = decl.getSuperClass() != null;
        boolean hasProtocols = !nonNull(decl.getProtocols()).isEmpty();
        try (Scope o = w.openObject(count(hasSuper, hasProtocols))) {
            if (hasSuper) {
                w.emitTag("super");
                common().emitDeclRef(decl.getSuperClass());
            }
            if (hasProtocols) {
                w.emitTag("protocols");
                common().emitDeclRefList(nonNull(decl.getProtocols()));
            }
        }
    }

    private void emitProtocols(ObjCContainerDecl decl) throws IOException {
        AstWriter w = writer();
        boolean hasProtocols = !nonNull(decl.getProtocols()).isEmpty();
        try (Scope o = w.openObject(count(hasProtocols))) {
            if (hasProtocols) {
                w.emitTag("protocols");
                common().emitDeclRefList(nonNull(decl.getProtocols()));
            }
        }
    }

    private static boolean hasStorageClass(StorageClass storageClass) {
        return storageClass != null && storageClass != StorageClass.NONE;
    }

    private CommonFieldEmitter common() {
        return session.getCommon();
    }

    private AstWriter writer() {
        return session.getWriter();
    }
}
