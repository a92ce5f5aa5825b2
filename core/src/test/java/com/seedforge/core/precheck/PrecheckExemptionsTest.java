package com.seedforge.core.precheck;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PrecheckExemptionsTest {

    @Test
    void scopes_match_url_host_and_domain() {
        PrecheckExemptions ex = PrecheckExemptions.parse(List.of(
                "url:https://maps.x.gov/app#/home",
                "host:Data.Y.gov",
                "domain:arcgis.com",
                "bare.z.gov"));

        assertThat(ex.rules()).hasSize(4);
        assertThat(ex.isExempt("https://maps.x.gov/app#/home")).isTrue();
        assertThat(ex.isExempt("https://maps.x.gov/other")).isFalse();
        assertThat(ex.isExempt("https://data.y.gov/anything")).isTrue();
        assertThat(ex.isExempt("https://services3.arcgis.com/q")).isTrue();
        assertThat(ex.isExempt("https://arcgis.com/")).isTrue();
        assertThat(ex.isExempt("https://notarcgis.com/")).isFalse();
        assertThat(ex.isExempt("https://bare.z.gov/")).isTrue();
    }

    @Test
    void comments_and_blank_lines_are_skipped(@TempDir Path dir) throws Exception {
        Path f = dir.resolve("exemptions.txt");
        Files.writeString(f, "# known flaky hosts\n\nhost:flaky.gov   # DNS is slow\n  \n");

        PrecheckExemptions ex = PrecheckExemptions.load(f);

        assertThat(ex.rules()).containsExactly(
                new PrecheckExemptions.Rule(PrecheckExemptions.Scope.HOST, "flaky.gov"));
    }

    @Test
    void merge_keeps_rules_of_both() {
        PrecheckExemptions a = PrecheckExemptions.parse(List.of("a.gov"));
        PrecheckExemptions b = PrecheckExemptions.parse(List.of("domain:b.gov"));

        PrecheckExemptions m = a.merge(b);

        assertThat(m.isExempt("https://a.gov/")).isTrue();
        assertThat(m.isExempt("https://www.b.gov/")).isTrue();
        assertThat(PrecheckExemptions.NONE.merge(PrecheckExemptions.NONE).isEmpty()).isTrue();
    }
}
