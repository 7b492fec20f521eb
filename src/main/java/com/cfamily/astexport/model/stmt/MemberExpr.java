package com.cfamily.astexport.model.stmt;

import com.cfamily.astexport.model.decl.ValueDecl;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class MemberExpr extends Expr {
    private boolean arrow;
    private ValueDecl memberDecl;
}
