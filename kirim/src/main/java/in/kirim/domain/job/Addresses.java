package in.kirim.domain.job;

/**
 * Recipient address normalization.
 *
 * Phone numbers become bare digits with the country code; group ids
 * ("...@g.us") pass through untouched.
 */
public final class Addresses {

    public static final String GROUP_SUFFIX = "@g.us";
    public static final String CHAT_SUFFIX = "@c.us";

    private final String countryCode;

    public Addresses(String countryCode) {
        this.countryCode = countryCode;
    }

    /**
     * Normalize a user or transport supplied address.
     *
     * @return normalized address, empty string when nothing is left
     */
    public String normalize(String input) {
        if (input == null) return "";
        String p = input.trim().replaceAll("[\\s-]", "");

        if (p.endsWith(GROUP_SUFFIX)) return p;
        if (p.endsWith(CHAT_SUFFIX)) {
            p = p.substring(0, p.length() - CHAT_SUFFIX.length());
        }

        if (p.startsWith("+" + countryCode)) return p.substring(1);
        if (p.startsWith(countryCode)) return p;
        if (p.startsWith("0")) return countryCode + p.substring(1);
        if (p.startsWith("+")) return p.substring(1);
        return p;
    }

    public static boolean isGroup(String address) {
        return address.endsWith(GROUP_SUFFIX);
    }

    /**
     * Transport chat id for a normalized address.
     */
    public static String toChatId(String address) {
        return isGroup(address) ? address : address + CHAT_SUFFIX;
    }
}
