package com.cfamily.astexport.model.decl;

public enum AccessSpecifier {
    NONE,
    PUBLIC,
    PROTECTED,
    PRIVATE
}
