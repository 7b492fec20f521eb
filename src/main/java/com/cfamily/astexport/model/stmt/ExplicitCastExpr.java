package com.cfamily.astexport.model.stmt;

import com.cfamily.astexport.model.QualType;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class ExplicitCastExpr extends CastExpr {
    private QualType typeAsWritten;
}
