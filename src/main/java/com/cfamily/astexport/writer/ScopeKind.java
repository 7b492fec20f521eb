package com.cfamily.astexport.writer;

public enum ScopeKind {
    OBJECT,
    ARRAY,
    TUPLE,
    VARIANT
}
