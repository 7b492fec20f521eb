package com.cfamily.astexport.model.type;

import com.cfamily.astexport.model.stmt.Expr;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * C99 VLA. The size expression is defined by the statement tree that contains it.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class VariableArrayType extends ChildType {
    private Expr sizeExpr;
}
