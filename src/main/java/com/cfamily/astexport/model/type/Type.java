package com.cfamily.astexport.model.type;

import com.cfamily.astexport.model.NodeId;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for type nodes. Types are interned by the front end and may form cycles;
 * they are defined once in the unit's type list and referenced by identity everywhere else.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class Type {

    private TypeKind kind;
    private NodeId id;
    private String spelling;

    /** Canonical form, when it differs from this type. */
    private Type desugared;

    /**
     * Types this type refers to, in field order. Used to close the unit's type list.
     */
    public List<Type> referencedTypes() {
        List<Type> out = new ArrayList<>();
        collectReferencedTypes(out);
        return out;
    }

    protected void collectReferencedTypes(List<Type> out) {
        if (desugared != null) {
            out.add(desugared);
        }
    }
}
