package in.kirim.messaging;

/**
 * Transport failure talking to the messaging network.
 */
public class MessagingException extends Exception {

    public MessagingException(String message) {
        super(message);
    }

    public MessagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
