package com.cfamily.astexport.model.stmt;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * {@code new} expression. Array size and initializer are among {@code children} and are
 * referenced here by identity only.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class CxxNewExpr extends Expr {
    private boolean array;
    private boolean global;
    private Expr arraySize;
    private Expr initializer;
}
