package in.kirim.repository;

import in.kirim.domain.job.RecentEntries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileRecentEntriesRepositoryTest {

    @TempDir
    Path dataDir;

    @Test
    void testRememberPersistsAcrossInstances() {
        new FileRecentEntriesRepository(dataDir).remember("acme", "628111 | hi", "default");

        RecentEntries loaded = new FileRecentEntriesRepository(dataDir).load("acme");

        assertEquals(List.of("628111 | hi"), loaded.targets());
        assertEquals(List.of("default"), loaded.messages());
        assertTrue(Files.exists(dataDir.resolve("recent.acme.json")));
    }

    @Test
    void testCorruptOrMissingIsEmpty() throws IOException {
        FileRecentEntriesRepository repository = new FileRecentEntriesRepository(dataDir);
        assertEquals(RecentEntries.empty(), repository.load("nobody"));

        Files.writeString(dataDir.resolve("recent.acme.json"), "{not json");
        assertEquals(RecentEntries.empty(), repository.load("acme"));
    }

    @Test
    void testDelete() {
        FileRecentEntriesRepository repository = new FileRecentEntriesRepository(dataDir);
        repository.remember("acme", "628111", "x");

        repository.delete("acme");
        repository.delete("acme");

        assertEquals(RecentEntries.empty(), repository.load("acme"));
    }
}
