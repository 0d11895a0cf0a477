package com.eios.collab.crdt;

import java.util.Comparator;

/**
 * Where a node sits: its parent and its order among siblings. Siblings sharing an
 * order index are ordered by the stamp of the placement that put them there.
 */
public record Placement(String parentId, long orderIndex, Stamp stamp) {

    static final Comparator<Placement> SIBLING_ORDER = Comparator
        .comparingLong(Placement::orderIndex)
        .thenComparing(Placement::stamp);
}
