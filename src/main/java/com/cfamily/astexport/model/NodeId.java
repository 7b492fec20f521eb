package com.cfamily.astexport.model;

import lombok.Value;

/**
 * Opaque identity of an AST node: the storage address the front end assigned to it.
 * <p>
 * Front-end identities are positive. Zero and the negative values are reserved for
 * the absent type and the per-family sentinels.
 */
@Value
public class NodeId implements Comparable<NodeId> {

    public static final NodeId ABSENT = new NodeId(0L);
    public static final NodeId SENTINEL_DECL = new NodeId(-1L);
    public static final NodeId SENTINEL_STMT = new NodeId(-2L);
    public static final NodeId SENTINEL_COMMENT = new NodeId(-3L);

    long address;

    public static NodeId of(long address) {
        return new NodeId(address);
    }

    public boolean isReserved() {
        return address <= 0;
    }

    /**
     * Raw rendering, e.g. {@code 0x7f3a10}. Reserved negative identities print as their
     * two's complement.
     */
    public String toRawString() {
        return "0x" + Long.toHexString(address);
    }

    @Override
    public int compareTo(NodeId other) {
        return Long.compare(address, other.address);
    }
}
