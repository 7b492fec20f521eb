package com.cfamily.astexport.schema;

import com.cfamily.astexport.model.NodeKind;
import com.cfamily.astexport.model.VariantNames;
import lombok.Value;

import java.util.List;

/**
 * Tuple layout of one kind as rendered in the schema document.
 */
@Value
public class KindLayout {
    String variantName;
    String tupleName;
    /** Tuple name of the parent kind, or {@code null} for the root. */
    String parentTupleName;
    List<String> ownFields;
    boolean abstractKind;
    int tupleSize;

    public static KindLayout of(NodeKind kind) {
        return new KindLayout(
                kind.getVariantName(),
                tupleName(kind),
                kind.getParent() == null ? null : tupleName(kind.getParent()),
                kind.getOwnFields(),
                kind.isAbstractKind(),
                KindHierarchy.tupleSize(kind));
    }

    private static String tupleName(NodeKind kind) {
        return VariantNames.toSnakeCase(kind.getVariantName()) + "_tuple";
    }
}
