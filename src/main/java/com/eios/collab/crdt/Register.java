package com.eios.collab.crdt;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Last-writer-wins register: the value written by the highest stamp.
 */
public record Register(JsonNode value, Stamp stamp) {

    public boolean loses(Stamp incoming) {
        return incoming.isAfter(stamp);
    }
}
