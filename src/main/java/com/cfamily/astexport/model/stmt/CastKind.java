package com.cfamily.astexport.model.stmt;

public enum CastKind {
    DEPENDENT,
    BIT_CAST,
    LVALUE_BIT_CAST,
    LVALUE_TO_RVALUE,
    NO_OP,
    BASE_TO_DERIVED,
    DERIVED_TO_BASE,
    UNCHECKED_DERIVED_TO_BASE,
    DYNAMIC,
    TO_UNION,
    ARRAY_TO_POINTER_DECAY,
    FUNCTION_TO_POINTER_DECAY,
    NULL_TO_POINTER,
    INTEGRAL_TO_POINTER,
    POINTER_TO_INTEGRAL,
    POINTER_TO_BOOLEAN,
    TO_VOID,
    INTEGRAL_CAST,
    INTEGRAL_TO_BOOLEAN,
    INTEGRAL_TO_FLOATING,
    FLOATING_TO_INTEGRAL,
    FLOATING_TO_BOOLEAN,
    FLOATING_CAST,
    BLOCK_POINTER_TO_OBJC_POINTER_CAST,
    USER_DEFINED_CONVERSION,
    CONSTRUCTOR_CONVERSION
}
