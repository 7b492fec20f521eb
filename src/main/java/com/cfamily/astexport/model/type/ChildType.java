package com.cfamily.astexport.model.type;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.List;

/**
 * A type built on exactly one other type: pointers, references, arrays (element type),
 * parens, adjusted/decayed types, {@code decltype} and {@code _Atomic}.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class ChildType extends Type {

    private Type child;

    @Override
    protected void collectReferencedTypes(List<Type> out) {
        super.collectReferencedTypes(out);
        if (child != null) {
            out.add(child);
        }
    }
}
