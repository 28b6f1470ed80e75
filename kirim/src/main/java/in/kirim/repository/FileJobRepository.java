package in.kirim.repository;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.kirim.domain.job.Addresses;
import in.kirim.domain.job.Job;
import in.kirim.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Job collections as JSON files: {@code <dataDir>/scheduledMessages.<tenantId>.json}.
 *
 * Features:
 * - Atomic replace on write (temp file + rename)
 * - Corrupt or non-array documents read as empty, logged at ERROR
 * - Records that fail to bind are skipped individually
 * - Documents written by the earlier service are migrated on read
 */
public final class FileJobRepository implements JobRepository {
    private static final Logger log = LoggerFactory.getLogger(FileJobRepository.class);

    private static final String PREFIX = "scheduledMessages.";
    private static final String SUFFIX = ".json";
    private static final Pattern FILE_NAME = Pattern.compile("^scheduledMessages\\.(.+)\\.json$");

    // Old field name -> current field name
    private static final Map<String, String> RENAMED_FIELDS = Map.of(
        "intervalMinutes", "intervalN",
        "remainingCount", "remainingRuns",
        "stopOnReplyKeyword", "stopKeyword",
        "gapSeconds", "dispatchGapSeconds"
    );

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Path dataDir;
    private final ZoneId zone;
    private final Addresses addresses;

    public FileJobRepository(Path dataDir, ZoneId zone, Addresses addresses) {
        this.dataDir = dataDir;
        this.zone = zone;
        this.addresses = addresses;
    }

    @Override
    public List<Job> readCollection(String tenantId) {
        Path file = fileFor(tenantId);
        if (!Files.exists(file)) {
            return List.of();
        }
        JsonNode root;
        try {
            String json = Files.readString(file);
            if (json.isBlank()) {
                return List.of();
            }
            root = MAPPER.readTree(json);
        } catch (IOException e) {
            log.error("Failed to read job document {}, starting empty: {}", file, e.getMessage());
            return List.of();
        }
        if (root == null || !root.isArray()) {
            log.error("Job document {} is not a JSON array, starting empty", file);
            return List.of();
        }

        List<Job> jobs = new ArrayList<>();
        for (JsonNode node : root) {
            if (!node.isObject()) continue;
            ObjectNode record = migrate((ObjectNode) node.deepCopy());
            try {
                jobs.add(MAPPER.treeToValue(record, Job.class));
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Skipping unreadable job record in {}: {}", file, e.getMessage());
            }
        }
        log.debug("Loaded {} jobs from {}", jobs.size(), file);
        return jobs;
    }

    @Override
    public void writeCollection(String tenantId, List<Job> jobs) {
        Path file = fileFor(tenantId);
        try {
            String json = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(jobs);
            AtomicFiles.write(file, json);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write job document " + file, e);
        }
    }

    @Override
    public void deleteCollection(String tenantId) {
        Path file = fileFor(tenantId);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete job document " + file, e);
        }
    }

    @Override
    public List<String> listTenantIds() {
        if (!Files.isDirectory(dataDir)) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        try (Stream<Path> files = Files.list(dataDir)) {
            files.forEach(path -> {
                Matcher m = FILE_NAME.matcher(path.getFileName().toString());
                if (m.matches()) {
                    ids.add(m.group(1));
                }
            });
        } catch (IOException e) {
            log.error("Failed to list job documents in {}: {}", dataDir, e.getMessage());
        }
        ids.sort(String::compareTo);
        return ids;
    }

    Path fileFor(String tenantId) {
        return dataDir.resolve(PREFIX + tenantId + SUFFIX);
    }

    /**
     * Bring a stored record to the current field layout.
     */
    private ObjectNode migrate(ObjectNode record) {
        // Single target/message pair from the oldest layout
        if (record.has("target") && !record.has("targets") && !record.has("recipients")) {
            ObjectNode pair = MAPPER.createObjectNode();
            pair.put("target", record.path("target").asText(""));
            pair.put("message", record.path("message").asText(""));
            record.putArray("targets").add(pair);
            record.put("targetsText", record.path("target").asText(""));
            record.put("defaultMessage", record.path("message").asText(""));
            record.remove("target");
            record.remove("message");
        }

        if (record.has("targets") && !record.has("recipients")) {
            ArrayNode recipients = record.putArray("recipients");
            StringBuilder text = new StringBuilder();
            for (JsonNode t : record.path("targets")) {
                String address = addresses.normalize(t.path("target").asText(""));
                String message = t.path("message").asText("");
                if (address.isEmpty()) continue;
                recipients.addObject().put("address", address).put("message", message);
                if (text.length() > 0) text.append('\n');
                text.append(address).append(" | ").append(message);
            }
            if (!record.hasNonNull("targetsText")) {
                record.put("targetsText", text.toString());
            }
            record.remove("targets");
        }

        migrateInstant(record, "datetimeISO", "anchorTime");
        migrateInstant(record, "repeatUntilISO", "repeatUntil");
        migrateInstant(record, "nextRunISO", "nextRunAt");
        if (record.has("repeatType") && !record.has("repeatPolicy")) {
            record.set("repeatPolicy", record.remove("repeatType"));
        }
        for (Map.Entry<String, String> rename : RENAMED_FIELDS.entrySet()) {
            if (record.has(rename.getKey()) && !record.has(rename.getValue())) {
                record.set(rename.getValue(), record.remove(rename.getKey()));
            }
        }

        if (!record.hasNonNull("dispatchGapSeconds")) {
            record.put("dispatchGapSeconds", Job.DEFAULT_GAP_SECONDS);
        }
        return record;
    }

    private void migrateInstant(ObjectNode record, String oldField, String newField) {
        if (!record.has(oldField)) return;
        JsonNode old = record.remove(oldField);
        if (record.has(newField) || old == null || !old.isTextual()) return;
        Timestamps.parse(old.asText(), zone)
            .ifPresent(instant -> record.put(newField, instant.toString()));
    }
}
