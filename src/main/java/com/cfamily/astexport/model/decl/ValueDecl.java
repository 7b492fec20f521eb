package com.cfamily.astexport.model.decl;

import com.cfamily.astexport.model.QualType;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public abstract class ValueDecl extends NamedDecl {
    private QualType type;
}
