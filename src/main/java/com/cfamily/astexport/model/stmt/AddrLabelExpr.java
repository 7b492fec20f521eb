package com.cfamily.astexport.model.stmt;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * GNU {@code &&label}.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class AddrLabelExpr extends Expr {
    private LabelStmt label;
}
