package com.cfamily.astexport.model.stmt;

public enum PredefinedIdentKind {
    FUNC,
    FUNCTION,
    L_FUNCTION,
    FUNC_D_NAME,
    FUNC_SIG,
    PRETTY_FUNCTION,
    PRETTY_FUNCTION_NO_VIRTUAL
}
