package in.kirim.service.dispatch;

/**
 * Outcome of delivering to one recipient.
 *
 * @param address   recipient address
 * @param delivered true when an attempt succeeded
 * @param attempts  attempts made
 * @param lastError message of the last failure, null when delivered
 */
public record RecipientResult(String address, boolean delivered, int attempts, String lastError) {

    public static RecipientResult delivered(String address, int attempts) {
        return new RecipientResult(address, true, attempts, null);
    }

    public static RecipientResult failed(String address, int attempts, String lastError) {
        return new RecipientResult(address, false, attempts, lastError);
    }
}
