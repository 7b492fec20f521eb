package com.cfamily.astexport.model.stmt;

import com.cfamily.astexport.model.QualType;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * {@code sizeof}/{@code alignof}. {@code argumentType} is set when the operand is a type;
 * an expression operand is the lone child.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class UnaryExprOrTypeTraitExpr extends Expr {
    private TraitKind trait;
    private QualType argumentType;
}
