package in.kirim.domain.job;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecentEntriesTest {

    @Test
    void testNewestFirstWithoutDuplicates() {
        RecentEntries entries = RecentEntries.empty()
            .remember("628111 | a\n628222 | b", "hello")
            .remember("628333 | c\n628111 | a", "hi");

        assertEquals(List.of("628333 | c", "628111 | a", "628222 | b"), entries.targets());
        assertEquals(List.of("hi", "hello"), entries.messages());
    }

    @Test
    void testCapsAreApplied() {
        RecentEntries entries = RecentEntries.empty();
        for (int i = 0; i < 50; i++) {
            entries = entries.remember("62800" + i, "message " + i);
        }

        assertEquals(RecentEntries.MAX_TARGETS, entries.targets().size());
        assertEquals(RecentEntries.MAX_MESSAGES, entries.messages().size());
        assertEquals("6280049", entries.targets().get(0));
        assertEquals("message 49", entries.messages().get(0));
    }

    @Test
    void testBlankValuesIgnored() {
        RecentEntries entries = RecentEntries.empty().remember("\n  \n", "  ");

        assertTrue(entries.targets().isEmpty());
        assertTrue(entries.messages().isEmpty());
    }
}
