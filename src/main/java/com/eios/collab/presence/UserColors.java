package com.eios.collab.presence;

import java.util.List;

/**
 * Stable cursor colour for a user that did not choose one.
 */
public final class UserColors {

    static final List<String> PALETTE = List.of(
        "#FF6B6B", "#4ECDC4", "#45B7D1", "#96CEB4", "#FFEAA7",
        "#DDA0DD", "#98D8C8", "#F7DC6F", "#BB8FCE", "#85C1E2");

    private UserColors() {
    }

    public static String forUser(String userId) {
        int hash = 0;
        for (int i = 0; i < userId.length(); i++) {
            hash = ((hash << 5) - hash) + userId.charAt(i);
        }
        return PALETTE.get(Math.floorMod(hash, PALETTE.size()));
    }
}
