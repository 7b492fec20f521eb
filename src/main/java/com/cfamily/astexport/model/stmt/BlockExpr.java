package com.cfamily.astexport.model.stmt;

import com.cfamily.astexport.model.decl.BlockDecl;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class BlockExpr extends Expr {
    private BlockDecl block;
}
