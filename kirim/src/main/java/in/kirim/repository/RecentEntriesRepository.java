package in.kirim.repository;

import in.kirim.domain.job.RecentEntries;

/**
 * Per-tenant recent entries document.
 */
public interface RecentEntriesRepository {
    RecentEntries load(String tenantId);

    /**
     * Merge one use into the stored entries and return the result.
     */
    RecentEntries remember(String tenantId, String targetsText, String defaultMessage);

    void delete(String tenantId);
}
