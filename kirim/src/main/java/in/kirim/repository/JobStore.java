package in.kirim.repository;

import in.kirim.domain.job.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * In-memory job collection of one tenant, written through to the repository
 * on every change.
 *
 * A change whose write fails is rolled back in memory before the exception
 * propagates, so memory never runs ahead of the document.
 */
public final class JobStore {
    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    private final String tenantId;
    private final JobRepository repository;
    private final List<Job> jobs;

    private JobStore(String tenantId, JobRepository repository, List<Job> initial) {
        this.tenantId = tenantId;
        this.repository = repository;
        this.jobs = new ArrayList<>(initial);
    }

    public static JobStore load(String tenantId, JobRepository repository) {
        List<Job> initial = repository.readCollection(tenantId);
        log.info("Job store loaded: tenant={} jobs={}", tenantId, initial.size());
        return new JobStore(tenantId, repository, initial);
    }

    public synchronized List<Job> all() {
        return List.copyOf(jobs);
    }

    public synchronized Optional<Job> find(long id) {
        int idx = indexOf(id);
        return idx < 0 ? Optional.empty() : Optional.of(jobs.get(idx));
    }

    public synchronized int size() {
        return jobs.size();
    }

    /**
     * @throws IllegalStateException if a job with the same id exists
     */
    public synchronized void insert(Job job) {
        if (indexOf(job.id()) >= 0) {
            throw new IllegalStateException("Duplicate job id " + job.id());
        }
        List<Job> snapshot = List.copyOf(jobs);
        jobs.add(job);
        persist(snapshot);
    }

    /**
     * Apply a change to the stored job, if it still exists.
     */
    public synchronized Optional<Job> update(long id, UnaryOperator<Job> change) {
        int idx = indexOf(id);
        if (idx < 0) {
            return Optional.empty();
        }
        Job updated = change.apply(jobs.get(idx));
        if (updated.equals(jobs.get(idx))) {
            return Optional.of(updated);
        }
        List<Job> snapshot = List.copyOf(jobs);
        jobs.set(idx, updated);
        persist(snapshot);
        return Optional.of(updated);
    }

    public synchronized boolean remove(long id) {
        int idx = indexOf(id);
        if (idx < 0) {
            return false;
        }
        List<Job> snapshot = List.copyOf(jobs);
        jobs.remove(idx);
        persist(snapshot);
        return true;
    }

    public String tenantId() {
        return tenantId;
    }

    private void persist(List<Job> rollback) {
        try {
            repository.writeCollection(tenantId, List.copyOf(jobs));
        } catch (RuntimeException e) {
            jobs.clear();
            jobs.addAll(rollback);
            throw e;
        }
    }

    private int indexOf(long id) {
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i).id() == id) {
                return i;
            }
        }
        return -1;
    }
}
