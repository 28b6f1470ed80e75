package in.kirim.domain.job;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Recently used target texts and default messages of a tenant, newest first.
 */
public record RecentEntries(
    @JsonProperty("targets") List<String> targets,
    @JsonProperty("messages") List<String> messages
) {
    public static final int MAX_TARGETS = 30;
    public static final int MAX_MESSAGES = 20;

    public RecentEntries {
        targets = targets == null ? List.of() : List.copyOf(targets);
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static RecentEntries empty() {
        return new RecentEntries(List.of(), List.of());
    }

    /**
     * Record one use; every non-blank line of the target text counts separately.
     */
    public RecentEntries remember(String targetsText, String defaultMessage) {
        List<String> t = new ArrayList<>(targets);
        if (targetsText != null) {
            String[] lines = targetsText.split("\\R");
            for (int i = lines.length - 1; i >= 0; i--) {
                pushFront(t, lines[i].trim(), MAX_TARGETS);
            }
        }
        List<String> m = new ArrayList<>(messages);
        if (defaultMessage != null) {
            pushFront(m, defaultMessage.trim(), MAX_MESSAGES);
        }
        return new RecentEntries(t, m);
    }

    private static void pushFront(List<String> list, String value, int max) {
        if (value.isEmpty()) return;
        list.remove(value);
        list.add(0, value);
        while (list.size() > max) {
            list.remove(list.size() - 1);
        }
    }
}
