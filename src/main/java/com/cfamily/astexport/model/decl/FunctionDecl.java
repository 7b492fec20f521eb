package com.cfamily.astexport.model.decl;

import com.cfamily.astexport.model.stmt.Stmt;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Functions, including C++ methods, constructors and destructors.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class FunctionDecl extends DeclaratorDecl {

    private StorageClass storageClass;
    private boolean inlineSpecified;
    private boolean virtualAsWritten;
    private boolean pure;
    private boolean deletedAsWritten;

    @Builder.Default
    private List<VarDecl> parameters = new ArrayList<>();

    /** Redeclaration that carries the body, when some redeclaration has one. */
    private FunctionDecl declWithBody;

    /** Body of this declaration; {@code null} for prototypes. */
    private Stmt body;
}
