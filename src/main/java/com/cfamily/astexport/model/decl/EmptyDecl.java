package com.cfamily.astexport.model.decl;

import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Declaration with no content; also the declaration sentinel.
 */
@SuperBuilder
@NoArgsConstructor
public class EmptyDecl extends Decl {
}
