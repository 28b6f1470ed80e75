package in.kirim.messaging;

/**
 * Events emitted by a {@link MessagingClient}.
 */
public interface MessagingListener {
    void onReady(String tenantId);

    void onNotReady(String tenantId, String reason);

    void onIncomingMessage(String tenantId, IncomingMessage message);
}
