package com.cfamily.astexport.model.stmt;

import com.cfamily.astexport.model.QualType;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class Expr extends Stmt {

    private QualType type;

    @Builder.Default
    private ValueKind valueKind = ValueKind.RVALUE;

    @Builder.Default
    private ObjectKind objectKind = ObjectKind.ORDINARY;
}
