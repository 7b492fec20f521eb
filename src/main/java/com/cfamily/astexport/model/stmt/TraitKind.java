package com.cfamily.astexport.model.stmt;

public enum TraitKind {
    SIZE_OF,
    ALIGN_OF,
    VEC_STEP,
    OPENMP_REQUIRED_SIMD_ALIGN
}
