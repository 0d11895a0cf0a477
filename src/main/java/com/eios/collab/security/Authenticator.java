package com.eios.collab.security;

import com.eios.collab.error.AuthRejectedException;
import com.eios.collab.room.DocumentKey;

/**
 * Decides who a connection is and whether it may join a document's room.
 */
public interface Authenticator {

    /**
     * Blocks on the identity collaborator.
     *
     * @throws AuthRejectedException when the connection must be refused
     */
    Identity authenticate(String bearer, DocumentKey document);
}
