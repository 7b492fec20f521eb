package com.cfamily.astexport.model.decl;

import com.cfamily.astexport.model.type.Type;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public abstract class TypeDecl extends NamedDecl {
    /** The type this declaration introduces; may be absent. */
    private Type typeForDecl;
}
