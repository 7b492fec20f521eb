package com.cfamily.astexport.model.stmt;

import com.cfamily.astexport.model.decl.CxxRecordDecl;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class LambdaExpr extends Expr {
    private CxxRecordDecl lambdaClass;
}
