package com.eios.collab.scenegraph;

import com.eios.collab.crdt.ReplicatedDocument;

import java.util.Set;

/**
 * Node, component and document-map vocabulary of the editor schema.
 */
public final class NodeTypes {

    public static final String GROUP = "group";
    public static final String COMPONENT = "component";

    public static final Set<String> NODE_TYPES = Set.of(
        GROUP, "text", "image", "shape", "rect", "circle", "line", "path", COMPONENT);

    public static final Set<String> COMPONENT_TYPES = Set.of(
        "RSVP", "TEXT", "IMAGE", "GALLERY", "COUNTDOWN", "MAP", "REGISTRY", "MUSIC", "VIDEO",
        "GUESTBOOK", "SOCIAL_LINKS", "SCHEDULE", "ACCOMMODATIONS", "DRESS_CODE", "FAQ", "CUSTOM_HTML");

    public static final Set<String> DOCUMENT_MAPS = Set.of("canvas", "theme", "settings", "assets");

    // Keys the materialized tree owns; never writable as properties.
    public static final Set<String> RESERVED_FIELDS = Set.of("id", "type", "children", "parentId");

    private NodeTypes() {
    }

    public static boolean isContainer(String type) {
        return GROUP.equals(type) || COMPONENT.equals(type) || ReplicatedDocument.ROOT_TYPE.equals(type);
    }
}
