package com.cfamily.astexport.model.stmt;

public enum BinaryOperatorKind {
    PTR_MEM_D,
    PTR_MEM_I,
    MUL,
    DIV,
    REM,
    ADD,
    SUB,
    SHL,
    SHR,
    LT,
    GT,
    LE,
    GE,
    EQ,
    NE,
    AND,
    XOR,
    OR,
    LAND,
    LOR,
    ASSIGN,
    MUL_ASSIGN,
    DIV_ASSIGN,
    REM_ASSIGN,
    ADD_ASSIGN,
    SUB_ASSIGN,
    SHL_ASSIGN,
    SHR_ASSIGN,
    AND_ASSIGN,
    XOR_ASSIGN,
    OR_ASSIGN,
    COMMA
}
