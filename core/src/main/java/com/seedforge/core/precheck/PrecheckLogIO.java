package com.seedforge.core.precheck;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.seedforge.core.model.PrecheckEntry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * precheck.log.json 읽기/쓰기.
 * 형식: { "<host>": { "timestamp": "...Z", "error": "timeout"|null, "urls": [...] }, ... }
 */
public final class PrecheckLogIO {
    public static final String FILE_NAME = "precheck.log.json";

    private static final TypeReference<LinkedHashMap<String, PrecheckEntry>> LOG_TYPE = new TypeReference<>() {};

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);             // ISO-8601(Z)로

    public Path write(Path dir, Map<String, PrecheckEntry> log) throws IOException {
        Files.createDirectories(dir);
        Path out = dir.resolve(FILE_NAME);
        om.writeValue(out.toFile(), log);
        return out;
    }

    public String toJson(Map<String, PrecheckEntry> log) throws IOException {
        return om.writeValueAsString(log);
    }

    public LinkedHashMap<String, PrecheckEntry> read(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("precheck log not found at: " + file.toAbsolutePath());
        }
        LinkedHashMap<String, PrecheckEntry> log = om.readValue(file.toFile(), LOG_TYPE);
        return log == null ? new LinkedHashMap<>() : log;
    }
}
