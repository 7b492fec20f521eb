package com.cfamily.astexport.model.decl;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * {@code typedef} and {@code using} alias declarations.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class TypedefNameDecl extends TypeDecl {
    private boolean modulePrivate;
}
