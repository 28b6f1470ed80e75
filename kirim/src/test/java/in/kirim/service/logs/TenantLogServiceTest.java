package in.kirim.service.logs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class TenantLogServiceTest {

    @TempDir
    Path logDir;

    private TenantLogService service;

    @BeforeEach
    void setUp() {
        service = new TenantLogService(logDir);
    }

    private void writeLines(String tenantId, int count) throws Exception {
        String content = IntStream.rangeClosed(1, count)
            .mapToObj(i -> "line " + i)
            .collect(Collectors.joining("\n", "", "\n"));
        Files.writeString(service.fileFor(tenantId), content);
    }

    @Test
    void testClampLines() {
        assertEquals(300, TenantLogService.clampLines(null));
        assertEquals(300, TenantLogService.clampLines(""));
        assertEquals(300, TenantLogService.clampLines("lots"));
        assertEquals(50, TenantLogService.clampLines("5"));
        assertEquals(2000, TenantLogService.clampLines("999999"));
        assertEquals(120, TenantLogService.clampLines(" 120 "));
    }

    @Test
    void testMissingFileReadsNoLogs() throws Exception {
        assertEquals(TenantLogService.NO_LOGS, service.tail("acme", 300));
    }

    @Test
    void testTailKeepsLastLines() throws Exception {
        writeLines("acme", 500);

        String tail = service.tail("acme", 50);

        String[] lines = tail.split("\n");
        assertEquals(50, lines.length);
        assertEquals("line 451", lines[0]);
        assertEquals("line 500", lines[49]);
    }

    @Test
    void testShortFileReturnedWhole() throws Exception {
        writeLines("acme", 3);

        assertEquals("line 1\nline 2\nline 3", service.tail("acme", 300));
    }

    @Test
    void testClearTruncates() throws Exception {
        writeLines("acme", 10);

        service.clear("acme");

        assertTrue(Files.exists(service.fileFor("acme")), "File should remain for the appender");
        assertEquals(0, Files.size(service.fileFor("acme")));
        assertEquals(TenantLogService.NO_LOGS, service.tail("acme", 300));
    }

    @Test
    void testClearMissingFileIsNoop() throws Exception {
        service.clear("acme");

        assertFalse(Files.exists(service.fileFor("acme")));
    }

    @Test
    void testFileNaming() {
        assertEquals(logDir.resolve("kirim-acme.log"), service.fileFor("acme"));
    }
}
