package com.cfamily.astexport.model.stmt;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * {@code static_cast} and friends; {@code castName} is the keyword as written.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class CxxNamedCastExpr extends ExplicitCastExpr {
    private String castName;
}
