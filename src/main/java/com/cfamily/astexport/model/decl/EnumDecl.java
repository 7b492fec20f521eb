package com.cfamily.astexport.model.decl;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class EnumDecl extends TagDecl {

    public enum Scope {
        CLASS,
        STRUCT
    }

    /** {@code null} for unscoped enums. */
    private Scope scope;
}
