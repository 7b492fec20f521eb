package com.cfamily.astexport.model.stmt;

import com.cfamily.astexport.model.decl.NamedDecl;
import com.cfamily.astexport.model.decl.ValueDecl;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * Use of a declared entity. {@code foundDecl} is set only when lookup went through a
 * different declaration, e.g. a using-declaration.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class DeclRefExpr extends Expr {
    private ValueDecl decl;
    private NamedDecl foundDecl;
}
