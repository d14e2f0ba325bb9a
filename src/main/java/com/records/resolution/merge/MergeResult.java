package com.records.resolution.merge;

import java.util.Objects;

/**
 * Result of a merge operation.
 *
 * @param status                 what happened
 * @param primaryEntityId        the surviving entity
 * @param duplicateEntityId      the entity merged away
 * @param relationshipsRepointed relationships moved from the duplicate to the primary
 * @param message                reason for a skip or failure, null on success
 */
public record MergeResult(
        MergeStatus status,
        String primaryEntityId,
        String duplicateEntityId,
        int relationshipsRepointed,
        String message
) {
    public MergeResult {
        Objects.requireNonNull(status, "status is required");
    }

    public static MergeResult merged(String primaryEntityId, String duplicateEntityId, int relationshipsRepointed) {
        return new MergeResult(MergeStatus.MERGED, primaryEntityId, duplicateEntityId, relationshipsRepointed, null);
    }

    public static MergeResult skipped(String primaryEntityId, String duplicateEntityId, String reason) {
        return new MergeResult(MergeStatus.SKIPPED, primaryEntityId, duplicateEntityId, 0, reason);
    }

    public static MergeResult failed(String primaryEntityId, String duplicateEntityId, String errorMessage) {
        return new MergeResult(MergeStatus.FAILED, primaryEntityId, duplicateEntityId, 0, errorMessage);
    }

    public boolean isMerged() {
        return status == MergeStatus.MERGED;
    }

    public boolean isFailure() {
        return status == MergeStatus.FAILED;
    }
}
