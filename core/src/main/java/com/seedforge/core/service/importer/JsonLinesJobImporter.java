package com.seedforge.core.service.importer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.seedforge.core.api.IJobImporter;
import com.seedforge.core.model.ImportRecord;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * 레코드를 JSON Lines 파일에 덧붙이는 로컬 importer. 잡 하나("file:&lt;파일명&gt;")로 보고한다.
 * dryRun이면 아무것도 쓰지 않고 건수만 로그.
 */
public final class JsonLinesJobImporter implements IJobImporter {
    private static final Logger LOG = Logger.getLogger(JsonLinesJobImporter.class.getName());

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Path out;
    private final boolean dryRun;

    public JsonLinesJobImporter(Path out, boolean dryRun) {
        this.out = Objects.requireNonNull(out, "out");
        this.dryRun = dryRun;
    }

    public String jobId() {
        return "file:" + out.getFileName();
    }

    @Override
    public Map<String, Integer> importRecords(List<ImportRecord> records) throws IOException {
        if (dryRun) {
            LOG.info(() -> "[dry-run] would import " + records.size() + " records to " + out);
            return Map.of(jobId(), 0);
        }
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (BufferedWriter w = Files.newBufferedWriter(out, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            for (ImportRecord r : records) {
                w.write(om.writeValueAsString(r));
                w.newLine();
            }
        }
        LOG.info(() -> "Imported " + records.size() + " records to " + out);
        return Map.of(jobId(), 0);
    }
}
