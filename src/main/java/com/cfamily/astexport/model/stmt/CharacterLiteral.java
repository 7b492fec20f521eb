package com.cfamily.astexport.model.stmt;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class CharacterLiteral extends Expr {
    private int value;
}
