package pfl.domain.lifecycle;

import pfl.dal.db.ScheduledJobCandidate;

import java.util.List;

/**
 * Source of scheduled work the job linker can match an observed print against
 * @since 15/01/2026
 */
public interface IScheduleProvider {
    /**
     * Scheduled or pending jobs assigned to the printer, earliest first
     */
    List<ScheduledJobCandidate> findPendingCandidates(String printerId);
}
