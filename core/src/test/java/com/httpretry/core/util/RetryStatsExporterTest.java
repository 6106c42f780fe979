package com.httpretry.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.httpretry.core.model.RetryStats;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RetryStatsExporterTest {

    @TempDir
    Path tmp;

    @Test
    void export_writes_counters_and_iso_timestamp() throws Exception {
        RetryStats stats = new RetryStats();
        stats.recordCall(3, true, 30);
        stats.recordCall(1, false, 10);

        Path out = new RetryStatsExporter().exportToFile(stats.snapshot(), tmp.resolve("nested/dir/stats.json"));

        assertTrue(Files.exists(out), "stats file should exist");
        JsonNode root = new ObjectMapper().readTree(out.toFile());
        assertEquals(2, root.get("callsTotal").asLong());
        assertEquals(4, root.get("attemptsTotal").asLong());
        assertEquals(2, root.get("retriesTotal").asLong());
        assertEquals(1, root.get("exhaustedTotal").asLong());
        assertEquals(20, root.get("avgCallMs").asLong());

        // 날짜는 숫자 타임스탬프가 아니라 ISO-8601 문자열
        assertTrue(root.get("takenAt").isTextual(), "takenAt should be text");
        assertNotNull(Instant.parse(root.get("takenAt").asText()));
    }

    @Test
    void null_snapshot_is_rejected() {
        var exporter = new RetryStatsExporter();
        assertThrows(IllegalArgumentException.class, () -> exporter.toJson(null));
        assertThrows(IllegalArgumentException.class, () -> exporter.exportToFile(null, tmp.resolve("x.json")));
    }
}
