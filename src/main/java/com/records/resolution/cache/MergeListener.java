package com.records.resolution.cache;

/**
 * Listener for entity merge events. Implementations can react to merges,
 * e.g., by invalidating cache entries.
 */
public interface MergeListener {

    /**
     * Called after a successful merge.
     *
     * @param primaryEntityId   the surviving entity
     * @param duplicateEntityId the entity that was merged in and deleted
     */
    void onMerge(String primaryEntityId, String duplicateEntityId);
}
