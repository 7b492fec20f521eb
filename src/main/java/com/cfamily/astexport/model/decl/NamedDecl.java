package com.cfamily.astexport.model.decl;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public abstract class NamedDecl extends Decl {

    private String name;

    /** Fully qualified name with {@code ::} separators, e.g. {@code ns::Outer::field}. */
    private String qualifiedName;
}
