package in.kirim.service.validation;

import in.kirim.domain.job.Addresses;
import in.kirim.domain.job.Recipient;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns the free-form target text of a job request into recipients.
 *
 * Format, one entry per line:
 * <pre>
 * 08123456789 | Hello there
 * 62811111111, 62822222222 | Same text for both
 * 120363000000000000@g.us
 * </pre>
 * A line without "|" uses the default message. Everything after the first
 * "|" is the message, so the text itself may contain "|".
 */
public final class RecipientParser {

    private final Addresses addresses;

    public RecipientParser(Addresses addresses) {
        this.addresses = addresses;
    }

    public List<Recipient> parse(String targetsText, String defaultMessage) {
        String fallback = defaultMessage == null ? "" : defaultMessage;
        List<Recipient> parsed = new ArrayList<>();

        if (targetsText != null) {
            for (String rawLine : targetsText.split("\\R+")) {
                String line = rawLine.trim();
                if (line.isEmpty()) continue;

                int bar = line.indexOf('|');
                String left = (bar < 0 ? line : line.substring(0, bar)).trim();
                String right = bar < 0 ? "" : line.substring(bar + 1).trim();
                if (left.isEmpty()) continue;

                String message = right.isEmpty() ? fallback : right;
                if (message.isEmpty()) continue;

                for (String target : left.split("[;,]+")) {
                    String address = addresses.normalize(target);
                    if (!address.isEmpty()) {
                        parsed.add(new Recipient(address, message));
                    }
                }
            }
        }

        // Same address and text only once, first occurrence wins
        Set<Recipient> unique = new LinkedHashSet<>(parsed);
        return List.copyOf(unique);
    }
}
