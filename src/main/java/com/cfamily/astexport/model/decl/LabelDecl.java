package com.cfamily.astexport.model.decl;

import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

@SuperBuilder
@NoArgsConstructor
public class LabelDecl extends NamedDecl {
}
