package com.seedforge.core.precheck;

import com.seedforge.core.model.PrecheckEntry;
import com.seedforge.core.model.Verdict;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PrecheckLogIOTest {

    private final PrecheckLogIO io = new PrecheckLogIO();

    private static LinkedHashMap<String, PrecheckEntry> sample() {
        Instant ts = Instant.parse("2024-05-01T12:00:00.5Z");
        LinkedHashMap<String, PrecheckEntry> log = new LinkedHashMap<>();
        log.put("zeta.gov", new PrecheckEntry(ts, Verdict.TIMEOUT, List.of("https://zeta.gov/a")));
        log.put("alpha.gov", new PrecheckEntry(ts, Verdict.REACHABLE, List.of("https://alpha.gov/")));
        return log;
    }

    @Test
    void json_has_iso_timestamps_null_errors_and_insertion_order() throws Exception {
        String json = io.toJson(sample());

        assertThat(json).contains("\"timestamp\":\"2024-05-01T12:00:00.500Z\"");
        assertThat(json).contains("\"error\":\"timeout\"");
        assertThat(json).contains("\"error\":null");
        assertThat(json).contains("\"urls\":[]");
        assertThat(json.indexOf("zeta.gov")).isLessThan(json.indexOf("alpha.gov"));
        assertThat(json).doesNotContain("unreachable").doesNotContain("verdict");
    }

    @Test
    void written_file_reads_back_in_order(@TempDir Path dir) throws Exception {
        Path file = io.write(dir.resolve("out"), sample());

        assertThat(file.getFileName().toString()).isEqualTo(PrecheckLogIO.FILE_NAME);
        Map<String, PrecheckEntry> back = io.read(file);
        assertThat(back.keySet()).containsExactly("zeta.gov", "alpha.gov");
        assertThat(back.get("zeta.gov").verdict()).isEqualTo(Verdict.TIMEOUT);
        assertThat(back.get("zeta.gov").urls).containsExactly("https://zeta.gov/a");
        assertThat(back.get("alpha.gov").isUnreachable()).isFalse();
    }

    @Test
    void reads_log_written_by_other_tools(@TempDir Path dir) throws Exception {
        Path f = dir.resolve("precheck.log.json");
        Files.writeString(f, "{\"x.gov\": {\"timestamp\": \"2024-01-02T03:04:05.678901Z\","
                + " \"error\": \"connection-reset\", \"urls\": [\"https://x.gov/1\"], \"extra\": 1}}");

        PrecheckEntry e = io.read(f).get("x.gov");

        assertThat(e.timestamp).isEqualTo(Instant.parse("2024-01-02T03:04:05.678901Z"));
        assertThat(e.verdict()).isEqualTo(Verdict.CONNECTION_RESET);
    }

    @Test
    void missing_file_is_io_error(@TempDir Path dir) {
        assertThatThrownBy(() -> io.read(dir.resolve("nope.json"))).isInstanceOf(IOException.class);
    }
}
