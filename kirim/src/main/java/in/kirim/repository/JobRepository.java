package in.kirim.repository;

import in.kirim.domain.job.Job;

import java.util.List;

/**
 * Durable job documents, one collection per tenant.
 */
public interface JobRepository {
    /**
     * All jobs of a tenant. Missing or unreadable documents yield an empty list.
     */
    List<Job> readCollection(String tenantId);

    /**
     * Replace the tenant's collection. All-or-nothing: readers see either the
     * previous or the new document, never a partial one.
     *
     * @throws java.io.UncheckedIOException when the document cannot be written
     */
    void writeCollection(String tenantId, List<Job> jobs);

    void deleteCollection(String tenantId);

    /**
     * Tenants that have a stored collection.
     */
    List<String> listTenantIds();
}
