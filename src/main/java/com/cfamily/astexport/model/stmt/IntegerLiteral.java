package com.cfamily.astexport.model.stmt;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class IntegerLiteral extends Expr {
    private boolean signed;
    private int bitWidth;
    /** Decimal text of the value. */
    private String value;
}
