package com.cfamily.astexport.model.decl;

import com.cfamily.astexport.model.stmt.Expr;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * Variables and function parameters.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class VarDecl extends DeclaratorDecl {
    private StorageClass storageClass;
    private TlsKind tlsKind;
    private boolean global;
    private boolean staticLocal;
    private boolean modulePrivate;
    private boolean nrvoVariable;
    private Expr init;
}
