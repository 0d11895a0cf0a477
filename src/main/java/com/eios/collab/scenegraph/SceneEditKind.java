package com.eios.collab.scenegraph;

public enum SceneEditKind {
    INSERT,
    DELETE,
    MOVE,
    REORDER,
    SET_PROPERTY,
    SET_PROPERTIES,
    SET_SETTING
}
