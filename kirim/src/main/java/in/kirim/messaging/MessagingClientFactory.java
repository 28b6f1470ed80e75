package in.kirim.messaging;

/**
 * Creates the messaging client of a tenant.
 */
@FunctionalInterface
public interface MessagingClientFactory {
    MessagingClient create(String tenantId);
}
