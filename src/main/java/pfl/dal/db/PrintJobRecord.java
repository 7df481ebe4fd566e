package pfl.dal.db;

import pfl.common.EJobStatus;

/**
 * One observed print on one printer. {@code endedAt} is null while the print runs.
 * @since 15/01/2026
 */
public record PrintJobRecord(
        long id,
        String printerId,
        String jobName,
        long startedAt,
        Long endedAt,
        EJobStatus status,
        Long scheduledJobId,
        Integer totalLayers,
        Double progressPercent,
        String errorCode,
        Long durationSeconds) {

    public boolean isOpen() {
        return endedAt == null;
    }

    public boolean isLinked() {
        return scheduledJobId != null;
    }
}
