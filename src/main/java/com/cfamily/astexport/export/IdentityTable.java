package com.cfamily.astexport.export;

import com.cfamily.astexport.model.NodeId;

import java.util.HashMap;
import java.util.Map;

/**
 * Dense renumbering of node identities in first-encounter order.
 * <p>
 * Owned by the caller: the table keeps growing across exports until {@link #reset()} is
 * called. Identical output for identical trees requires a reset before each export.
 * Not thread-safe.
 */
public class IdentityTable {

    private final Map<NodeId, Integer> indexes = new HashMap<>();

    public int indexOf(NodeId id) {
        return indexes.computeIfAbsent(id, k -> indexes.size());
    }

    public int size() {
        return indexes.size();
    }

    public void reset() {
        indexes.clear();
    }
}
