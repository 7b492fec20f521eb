package com.cfamily.astexport.export;

import com.cfamily.astexport.model.NodeId;
import com.cfamily.astexport.model.decl.TranslationUnitDecl;
import com.cfamily.astexport.model.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The flattened, ordered list of types defined by one translation unit.
 * <p>
 * Starts from the unit's registered types in registration order, appends every type they
 * reach through type-to-type references in discovery order, and ends with the absent type.
 * Identities are unique in the list.
 */
public final class TypeArena {

    private final List<Type> types;
    private final Set<NodeId> ids;

    private TypeArena(List<Type> types, Set<NodeId> ids) {
        this.types = Collections.unmodifiableList(types);
        this.ids = ids;
    }

    public static TypeArena build(TranslationUnitDecl unit, Type absentType) {
        List<Type> ordered = new ArrayList<>();
        Set<NodeId> seen = new HashSet<>();
        seen.add(absentType.getId());

        if (unit.getTypes() != null) {
            for (Type type : unit.getTypes()) {
                add(type, ordered, seen);
            }
        }
        for (int i = 0; i < ordered.size(); i++) {
            for (Type referenced : ordered.get(i).referencedTypes()) {
                add(referenced, ordered, seen);
            }
        }
        ordered.add(absentType);
        return new TypeArena(ordered, seen);
    }

    private static void add(Type type, List<Type> ordered, Set<NodeId> seen) {
        if (type != null && type.getId() != null && seen.add(type.getId())) {
            ordered.add(type);
        }
    }

    public List<Type> getTypes() {
        return types;
    }

    public boolean contains(NodeId id) {
        return ids.contains(id);
    }

    public int size() {
        return types.size();
    }
}
