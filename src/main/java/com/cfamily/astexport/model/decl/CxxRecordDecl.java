package com.cfamily.astexport.model.decl;

import com.cfamily.astexport.model.BaseSpecifier;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class CxxRecordDecl extends RecordDecl {

    @Builder.Default
    private List<BaseSpecifier> bases = new ArrayList<>();

    @Builder.Default
    private List<BaseSpecifier> virtualBases = new ArrayList<>();

    /** POD-like record that could have been written in C. */
    private boolean cLike;
}
