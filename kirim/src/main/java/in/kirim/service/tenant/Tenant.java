package in.kirim.service.tenant;

import in.kirim.messaging.MessagingClient;
import in.kirim.repository.JobStore;
import in.kirim.service.dispatch.DispatchQueue;
import in.kirim.service.schedule.JobScheduler;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One isolated tenant: its job store, dispatch queue, scheduler and
 * messaging client. Nothing here is shared with another tenant.
 */
public final class Tenant {

    private final String tenantId;
    private final JobStore store;
    private final DispatchQueue queue;
    private final JobScheduler scheduler;
    private final MessagingClient client;
    private final AtomicBoolean started = new AtomicBoolean();

    Tenant(String tenantId, JobStore store, DispatchQueue queue,
           JobScheduler scheduler, MessagingClient client) {
        this.tenantId = tenantId;
        this.store = store;
        this.queue = queue;
        this.scheduler = scheduler;
        this.client = client;
    }

    public String tenantId() {
        return tenantId;
    }

    public JobScheduler scheduler() {
        return scheduler;
    }

    public MessagingClient client() {
        return client;
    }

    JobStore store() {
        return store;
    }

    DispatchQueue queue() {
        return queue;
    }

    /**
     * @return true only for the first call
     */
    boolean markStarted() {
        return started.compareAndSet(false, true);
    }

    public TenantStatus status() {
        return new TenantStatus(tenantId, client.isReady(), store.size(),
            scheduler.armedCount(), queue.size());
    }
}
