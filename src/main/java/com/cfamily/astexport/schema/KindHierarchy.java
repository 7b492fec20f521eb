package com.cfamily.astexport.schema;

import com.cfamily.astexport.exception.SchemaException;
import com.cfamily.astexport.exception.UnknownKindException;
import com.cfamily.astexport.model.NodeFamily;
import com.cfamily.astexport.model.NodeKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Field-arity resolution over the static kind trees.
 * <p>
 * A kind's tuple holds its ancestors' fields, most general first, followed by its own.
 * Its size therefore depends on the kind alone, never on the node.
 */
public final class KindHierarchy {

    private static final int MAX_DEPTH = 64;

    private KindHierarchy() {
        // Utility class
    }

    public static int tupleSize(NodeKind kind) {
        int size = 0;
        int depth = 0;
        for (NodeKind k = kind; k != null; k = k.getParent()) {
            if (++depth > MAX_DEPTH) {
                throw new SchemaException("Parent chain of " + kind.getVariantName() + " does not terminate");
            }
            size += k.getOwnFieldCount();
        }
        return size;
    }

    /**
     * Ancestors of {@code kind} from the root down to {@code kind} itself.
     */
    public static List<NodeKind> lineage(NodeKind kind) {
        List<NodeKind> chain = new ArrayList<>();
        for (NodeKind k = kind; k != null; k = k.getParent()) {
            chain.add(0, k);
        }
        return chain;
    }

    /**
     * Resolves a kind received as data, e.g. from a document being read back.
     */
    public static NodeKind resolve(NodeFamily family, String variantName) {
        for (NodeKind kind : family.kinds()) {
            if (kind.getVariantName().equals(variantName)) {
                return kind;
            }
        }
        throw new UnknownKindException("Unknown " + family.getSchemaName() + " kind: " + variantName);
    }

    public static int tupleSizeOf(NodeFamily family, String variantName) {
        NodeKind kind = resolve(family, variantName);
        if (kind.isAbstractKind()) {
            throw new UnknownKindException("Abstract " + family.getSchemaName() + " kind has no tuple: " + variantName);
        }
        return tupleSize(kind);
    }

    /**
     * Checks that a node may be dispatched under {@code kind}: the kind is set, concrete,
     * and its node class accepts the node.
     */
    public static <K extends NodeKind> K checkDispatchable(K kind, Object node, NodeFamily family) {
        if (kind == null) {
            throw new UnknownKindException(
                    "A " + family.getSchemaName() + " node of class " + node.getClass().getSimpleName() + " has no kind");
        }
        if (kind.isAbstractKind()) {
            throw new UnknownKindException("Abstract kind " + kind.getVariantName() + " cannot be emitted");
        }
        if (!kind.getNodeClass().isInstance(node)) {
            throw new SchemaException("Kind " + kind.getVariantName() + " requires "
                    + kind.getNodeClass().getSimpleName() + " but node is " + node.getClass().getSimpleName());
        }
        return kind;
    }

    /**
     * Structural checks over one family's table. Returns every problem found.
     */
    public static List<String> validate(NodeFamily family) {
        List<String> errors = new ArrayList<>();
        List<NodeKind> kinds = family.kinds();
        Set<String> names = new HashSet<>();
        int roots = 0;

        for (NodeKind kind : kinds) {
            if (!names.add(kind.getVariantName())) {
                errors.add("Duplicate variant name " + kind.getVariantName());
            }
            if (kind.getParent() == null) {
                roots++;
            } else if (kind.getParent().getFamily() != family) {
                errors.add(kind.getVariantName() + " has a parent from another family");
            }
            if (!terminates(kind, kinds.size())) {
                errors.add("Parent chain of " + kind.getVariantName() + " does not terminate");
                continue;
            }
            if (kind.getNodeClass() == null) {
                errors.add(kind.getVariantName() + " has no node class");
                continue;
            }
            NodeKind parent = kind.getParent();
            if (parent != null && parent.getNodeClass() != null
                    && !parent.getNodeClass().isAssignableFrom(kind.getNodeClass())) {
                errors.add(kind.getVariantName() + " node class " + kind.getNodeClass().getSimpleName()
                        + " does not extend " + parent.getNodeClass().getSimpleName());
            }
        }
        if (roots != 1) {
            errors.add(family.getSchemaName() + " has " + roots + " roots, expected 1");
        }
        return errors;
    }

    private static boolean terminates(NodeKind kind, int limit) {
        int steps = 0;
        for (NodeKind k = kind; k != null; k = k.getParent()) {
            if (++steps > limit) {
                return false;
            }
        }
        return true;
    }
}
