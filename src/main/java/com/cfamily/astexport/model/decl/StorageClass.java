package com.cfamily.astexport.model.decl;

public enum StorageClass {
    NONE,
    EXTERN,
    STATIC,
    PRIVATE_EXTERN,
    AUTO,
    REGISTER
}
