package com.eios.collab.security;

/**
 * Authenticated user of a connection.
 *
 * @param canEdit {@code false} for viewers, who join read-only
 */
public record Identity(String userId, String displayName, boolean canEdit) {}
