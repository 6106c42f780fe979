package com.httpretry.core.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.httpretry.core.model.RetryStats;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** RetryStats 스냅샷을 JSON으로 내보낸다(날짜는 ISO-8601). */
public final class RetryStatsExporter {
    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public String toJson(RetryStats.Snapshot snapshot) throws IOException {
        if (snapshot == null) throw new IllegalArgumentException("snapshot is null");
        return om.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
    }

    /** 상위 디렉터리가 없으면 만들고 덮어쓴다. */
    public Path exportToFile(RetryStats.Snapshot snapshot, Path file) throws IOException {
        if (snapshot == null) throw new IllegalArgumentException("snapshot is null");
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        om.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), snapshot);
        return file;
    }
}
