package com.cfamily.astexport.model.decl;

/**
 * Thread-local storage kind of a variable.
 */
public enum TlsKind {
    NONE,
    STATIC,
    DYNAMIC
}
