package com.cfamily.astexport.export;

import com.cfamily.astexport.model.NodeId;

/**
 * Renders node identities: raw addresses, or dense indexes from an {@link IdentityTable}.
 */
public class IdentityEncoder {

    private final boolean raw;
    private final IdentityTable table;

    public IdentityEncoder(boolean raw, IdentityTable table) {
        this.raw = raw;
        this.table = table;
    }

    public String encode(NodeId id) {
        NodeId key = id == null ? NodeId.ABSENT : id;
        if (raw) {
            return key.toRawString();
        }
        return Integer.toString(table.indexOf(key));
    }
}
