package com.cfamily.astexport.model;

import java.util.List;

/**
 * A member of one family's closed kind enumeration.
 * <p>
 * Every kind names exactly one parent (roots return {@code null}) and the schema field
 * types it adds on top of its parent, in emission order.
 */
public interface NodeKind {

    String name();

    NodeKind getParent();

    String getVariantName();

    boolean isAbstractKind();

    List<String> getOwnFields();

    Class<?> getNodeClass();

    NodeFamily getFamily();

    default int getOwnFieldCount() {
        return getOwnFields().size();
    }
}
