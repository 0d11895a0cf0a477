package com.eios.collab.scenegraph;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What a batch of operations does, in editor terms.
 */
public record EditSummary(
    List<String> inserted,
    List<String> deleted,
    List<String> moved,
    Map<String, Set<String>> changedFields,
    Map<String, Set<String>> changedSettings
) {

    public boolean isEmpty() {
        return inserted.isEmpty() && deleted.isEmpty() && moved.isEmpty()
            && changedFields.isEmpty() && changedSettings.isEmpty();
    }
}
