package com.seedforge.core.util;

import com.seedforge.core.model.SeedConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class YamlConfigLoaderTest {

    @Test
    void reads_all_sections(@TempDir Path dir) throws Exception {
        Path yml = dir.resolve("seeds.yml");
        Files.writeString(yml, String.join("\n",
                "precheck:",
                "  concurrency: 8",
                "  connectTimeoutMs: 15000",
                "  readTimeoutMs: 4000",
                "  retries: 1",
                "  backoffMs: 250",
                "  userAgent: 'Tester/1'",
                "  exemptions: ['host:a.gov', 'domain:arcgis.com']",
                "packing:",
                "  size: 500",
                "  singleGroupSize: 200",
                "  workers: 3",
                "browsertrix:",
                "  operator: '\"Ops\" <ops@example.org>'",
                "  pageLoadTimeout: 90",
                "  rolloverSize: 1_000_000",
                "  options:",
                "    behaviors: autoscroll",
                "catalog:",
                "  ignoreUrls:",
                "    - https://dead.gov/",
                "output:",
                "  dir: seeds-out",
                "unknownSection: 1",
                ""));

        SeedConfig cfg = YamlConfigLoader.load(yml);

        assertThat(cfg.precheck().getConcurrency()).isEqualTo(8);
        assertThat(cfg.precheck().getConnectTimeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(cfg.precheck().getReadTimeout()).isEqualTo(Duration.ofSeconds(4));
        assertThat(cfg.precheck().getRetries()).isEqualTo(1);
        assertThat(cfg.precheck().getBackoffMs()).isEqualTo(250);
        assertThat(cfg.precheck().getUserAgent()).isEqualTo("Tester/1");
        assertThat(cfg.precheck().getExemptions()).containsExactly("host:a.gov", "domain:arcgis.com");

        assertThat(cfg.packing().getSize()).isEqualTo(500);
        assertThat(cfg.packing().getSingleGroupSize()).isEqualTo(200);
        assertThat(cfg.packing().effectiveSingleGroupSize()).isEqualTo(200);
        assertThat(cfg.packing().getWorkers()).isEqualTo(3);

        assertThat(cfg.browsertrix().getOperator()).isEqualTo("\"Ops\" <ops@example.org>");
        assertThat(cfg.browsertrix().getPageLoadTimeout()).isEqualTo(90);
        assertThat(cfg.browsertrix().getRolloverSize()).isEqualTo(1_000_000L);
        assertThat(cfg.browsertrix().getOptions()).containsEntry("behaviors", "autoscroll");

        assertThat(cfg.getIgnoreUrls()).containsExactly("https://dead.gov/");
        assertThat(cfg.getOutputDir()).isEqualTo(Path.of("seeds-out"));
    }

    @Test
    void empty_file_keeps_defaults(@TempDir Path dir) throws Exception {
        Path yml = dir.resolve("seeds.yml");
        Files.writeString(yml, "");

        SeedConfig cfg = YamlConfigLoader.load(yml);

        assertThat(cfg.precheck().getConcurrency()).isEqualTo(5);
        assertThat(cfg.packing().getSize()).isEqualTo(1000);
        assertThat(cfg.packing().getWorkers()).isEqualTo(2);
        assertThat(cfg.browsertrix().getOperator()).isEqualTo(SeedConfig.DEFAULT_OPERATOR);
    }

    @Test
    void comma_separated_list_is_accepted(@TempDir Path dir) throws Exception {
        Path yml = dir.resolve("seeds.yml");
        Files.writeString(yml, "precheck:\n  exemptions: a.gov, b.gov\n");

        assertThat(YamlConfigLoader.load(yml).precheck().getExemptions()).containsExactly("a.gov", "b.gov");
    }

    @Test
    void invalid_values_fail_validation(@TempDir Path dir) throws Exception {
        Path yml = dir.resolve("seeds.yml");
        Files.writeString(yml, "packing:\n  size: 0\n");

        assertThatThrownBy(() -> YamlConfigLoader.load(yml))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("packing.size");
    }

    @Test
    void missing_file_is_io_error(@TempDir Path dir) {
        assertThatThrownBy(() -> YamlConfigLoader.load(dir.resolve("nope.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("seeds.yml not found");
    }
}
