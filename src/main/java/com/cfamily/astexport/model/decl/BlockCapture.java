package com.cfamily.astexport.model.decl;

import com.cfamily.astexport.model.stmt.Expr;
import lombok.Builder;
import lombok.Value;

/**
 * A variable captured by a block. {@code copyExpr} is owned by the capture.
 */
@Value
@Builder
public class BlockCapture {
    VarDecl variable;
    boolean byRef;
    boolean nested;
    Expr copyExpr;
}
