package in.kirim.repository;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.kirim.domain.job.RecentEntries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Recent entries as {@code <dataDir>/recent.<tenantId>.json}.
 */
public final class FileRecentEntriesRepository implements RecentEntriesRepository {
    private static final Logger log = LoggerFactory.getLogger(FileRecentEntriesRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Path dataDir;

    public FileRecentEntriesRepository(Path dataDir) {
        this.dataDir = dataDir;
    }

    @Override
    public synchronized RecentEntries load(String tenantId) {
        Path file = fileFor(tenantId);
        if (!Files.exists(file)) {
            return RecentEntries.empty();
        }
        try {
            RecentEntries entries = MAPPER.readValue(Files.readString(file), RecentEntries.class);
            return entries == null ? RecentEntries.empty() : entries;
        } catch (IOException e) {
            log.error("Failed to read recent entries {}: {}", file, e.getMessage());
            return RecentEntries.empty();
        }
    }

    @Override
    public synchronized RecentEntries remember(String tenantId, String targetsText, String defaultMessage) {
        RecentEntries updated = load(tenantId).remember(targetsText, defaultMessage);
        Path file = fileFor(tenantId);
        try {
            AtomicFiles.write(file, MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(updated));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write recent entries " + file, e);
        }
        return updated;
    }

    @Override
    public synchronized void delete(String tenantId) {
        Path file = fileFor(tenantId);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete recent entries " + file, e);
        }
    }

    private Path fileFor(String tenantId) {
        return dataDir.resolve("recent." + tenantId + ".json");
    }
}
