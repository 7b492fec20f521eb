package com.cfamily.astexport.model.stmt;

public enum UnaryOperatorKind {
    POST_INC,
    POST_DEC,
    PRE_INC,
    PRE_DEC,
    ADDR_OF,
    DEREF,
    PLUS,
    MINUS,
    NOT,
    LNOT,
    REAL,
    IMAG,
    EXTENSION
}
