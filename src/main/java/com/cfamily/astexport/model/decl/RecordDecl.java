package com.cfamily.astexport.model.decl;

import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * {@code struct} and {@code union}.
 */
@SuperBuilder
@NoArgsConstructor
public class RecordDecl extends TagDecl {
}
