package com.cfamily.astexport.model.decl;

import com.cfamily.astexport.model.stmt.Expr;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class FieldDecl extends DeclaratorDecl {
    private boolean mutable;
    private boolean modulePrivate;
    private Expr init;
    private Expr bitWidth;
}
