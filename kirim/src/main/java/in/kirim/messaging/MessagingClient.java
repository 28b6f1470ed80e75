package in.kirim.messaging;

/**
 * One tenant's connection to the messaging network.
 *
 * Readiness may toggle any number of times over the life of a client;
 * listeners are told about every change.
 */
public interface MessagingClient {

    String tenantId();

    /**
     * Start connecting. Returns immediately; readiness is reported to listeners.
     */
    void connect();

    boolean isReady();

    /**
     * Send one text.
     *
     * @param address normalized recipient address
     * @return true when the transport accepted the message
     * @throws MessagingException on transport errors
     */
    boolean send(String address, String text) throws MessagingException;

    void addListener(MessagingListener listener);

    /**
     * Hand an inbound message to the listeners.
     */
    void deliverIncoming(IncomingMessage message);

    /**
     * End the session but keep the client usable for a later connect.
     */
    void logout() throws MessagingException;

    /**
     * Release every resource of the client. It is not used afterwards.
     */
    void destroy() throws MessagingException;
}
