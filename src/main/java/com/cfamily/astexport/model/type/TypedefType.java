package com.cfamily.astexport.model.type;

import com.cfamily.astexport.model.decl.TypedefNameDecl;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.List;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class TypedefType extends Type {

    /** The aliased type. */
    private Type child;

    private TypedefNameDecl decl;

    @Override
    protected void collectReferencedTypes(List<Type> out) {
        super.collectReferencedTypes(out);
        if (child != null) {
            out.add(child);
        }
    }
}
