package com.cfamily.astexport.model.type;

import com.cfamily.astexport.model.QualType;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Function types with and without prototype. Parameters are ignored for the latter.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class FunctionType extends Type {

    private QualType returnType;

    @Builder.Default
    private List<QualType> paramTypes = new ArrayList<>();

    private boolean variadic;

    @Override
    protected void collectReferencedTypes(List<Type> out) {
        super.collectReferencedTypes(out);
        if (returnType != null && returnType.getType() != null) {
            out.add(returnType.getType());
        }
        if (paramTypes == null) {
            return;
        }
        for (QualType param : paramTypes) {
            if (param != null && param.getType() != null) {
                out.add(param.getType());
            }
        }
    }
}
