package com.cfamily.astexport.model.type;

public enum BuiltinKind {
    VOID,
    BOOL,
    CHAR_U,
    UCHAR,
    CHAR16,
    CHAR32,
    USHORT,
    UINT,
    ULONG,
    ULONG_LONG,
    UINT128,
    CHAR_S,
    SCHAR,
    WCHAR_S,
    WCHAR_U,
    SHORT,
    INT,
    LONG,
    LONG_LONG,
    INT128,
    HALF,
    FLOAT,
    DOUBLE,
    LONG_DOUBLE,
    NULL_PTR,
    OBJC_ID,
    OBJC_CLASS,
    OBJC_SEL,
    DEPENDENT
}
