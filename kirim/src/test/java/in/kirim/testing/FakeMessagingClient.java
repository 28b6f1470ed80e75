package in.kirim.testing;

import in.kirim.messaging.IncomingMessage;
import in.kirim.messaging.MessagingClient;
import in.kirim.messaging.MessagingException;
import in.kirim.messaging.MessagingListener;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory messaging client. Sends are recorded; an address can be made to
 * fail a number of times (or forever) before it succeeds.
 */
public final class FakeMessagingClient implements MessagingClient {

    public record Sent(String address, String text) {}

    private final String tenantId;
    private final List<MessagingListener> listeners = new CopyOnWriteArrayList<>();
    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private final Map<String, AtomicInteger> failuresLeft = new ConcurrentHashMap<>();
    private final AtomicInteger connects = new AtomicInteger();
    private final AtomicInteger logouts = new AtomicInteger();
    private volatile boolean ready;
    private volatile boolean destroyed;

    public FakeMessagingClient(String tenantId, boolean ready) {
        this.tenantId = tenantId;
        this.ready = ready;
    }

    public void failNext(String address, int times) {
        failuresLeft.put(address, new AtomicInteger(times));
    }

    public void failAlways(String address) {
        failNext(address, Integer.MAX_VALUE);
    }

    /**
     * Change readiness and notify listeners, as the real client does on a transition.
     */
    public void setReady(boolean value) {
        boolean changed = ready != value;
        ready = value;
        if (!changed) return;
        for (MessagingListener listener : listeners) {
            if (value) {
                listener.onReady(tenantId);
            } else {
                listener.onNotReady(tenantId, "test");
            }
        }
    }

    public List<Sent> sent() {
        return new ArrayList<>(sent);
    }

    public int connects() {
        return connects.get();
    }

    public int logouts() {
        return logouts.get();
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public String tenantId() {
        return tenantId;
    }

    @Override
    public void connect() {
        connects.incrementAndGet();
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    @Override
    public boolean send(String address, String text) throws MessagingException {
        AtomicInteger left = failuresLeft.get(address);
        if (left != null && left.getAndDecrement() > 0) {
            throw new MessagingException("simulated failure for " + address);
        }
        sent.add(new Sent(address, text));
        return true;
    }

    @Override
    public void addListener(MessagingListener listener) {
        listeners.add(listener);
    }

    @Override
    public void deliverIncoming(IncomingMessage message) {
        for (MessagingListener listener : listeners) {
            listener.onIncomingMessage(tenantId, message);
        }
    }

    @Override
    public void logout() {
        logouts.incrementAndGet();
        setReady(false);
    }

    @Override
    public void destroy() {
        destroyed = true;
    }
}
