package com.cfamily.astexport.model.stmt;

public enum ObjectKind {
    ORDINARY,
    BIT_FIELD,
    VECTOR_COMPONENT,
    OBJC_PROPERTY,
    OBJC_SUBSCRIPT
}
