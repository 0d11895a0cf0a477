package com.eios.collab.crdt;

public enum OperationType {
    INSERT_NODE,
    DELETE_NODE,
    SET_FIELD,
    MOVE_NODE,
    SET_META
}
