package com.cfamily.astexport.model.decl;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class FileScopeAsmDecl extends Decl {
    private String asmString;
}
