package com.cfamily.astexport.model.type;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class BuiltinType extends Type {
    private BuiltinKind builtinKind;
}
