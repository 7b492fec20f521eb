package com.cfamily.astexport.model.stmt;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * Placeholder for a value computed elsewhere. The source expression is owned here.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class OpaqueValueExpr extends Expr {
    private Expr sourceExpr;
}
