package in.kirim.testing;

import in.kirim.domain.job.Job;
import in.kirim.repository.JobRepository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Job repository kept in memory. Writes can be made to fail.
 */
public final class InMemoryJobRepository implements JobRepository {

    private final Map<String, List<Job>> collections = new ConcurrentHashMap<>();
    private final AtomicInteger writes = new AtomicInteger();
    private volatile boolean failWrites;

    public void failWrites(boolean fail) {
        this.failWrites = fail;
    }

    public int writes() {
        return writes.get();
    }

    public void seed(String tenantId, List<Job> jobs) {
        collections.put(tenantId, List.copyOf(jobs));
    }

    @Override
    public List<Job> readCollection(String tenantId) {
        return new ArrayList<>(collections.getOrDefault(tenantId, List.of()));
    }

    @Override
    public void writeCollection(String tenantId, List<Job> jobs) {
        if (failWrites) {
            throw new UncheckedIOException(new IOException("simulated disk failure"));
        }
        writes.incrementAndGet();
        collections.put(tenantId, List.copyOf(jobs));
    }

    @Override
    public void deleteCollection(String tenantId) {
        collections.remove(tenantId);
    }

    @Override
    public List<String> listTenantIds() {
        return new ArrayList<>(collections.keySet());
    }
}
