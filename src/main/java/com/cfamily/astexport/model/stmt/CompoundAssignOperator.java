package com.cfamily.astexport.model.stmt;

import com.cfamily.astexport.model.QualType;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * {@code a op= b}; carries the types the operation is computed in.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class CompoundAssignOperator extends BinaryOperator {
    private QualType computationLhsType;
    private QualType computationResultType;
}
