package com.cfamily.astexport.model.stmt;

public enum ValueKind {
    RVALUE,
    LVALUE,
    XVALUE
}
