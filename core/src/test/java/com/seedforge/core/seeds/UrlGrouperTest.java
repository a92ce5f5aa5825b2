package com.seedforge.core.seeds;

import com.seedforge.core.error.InvalidHostnameException;
import com.seedforge.core.model.GroupBy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class UrlGrouperTest {

    private static final List<String> URLS = List.of(
            "https://www.epa.gov/a",
            "https://x.noaa.gov/b",
            "https://epa.gov/c",
            "https://services.arcgis.com/d",
            "https://foo.maps.arcgis.com/e",
            "https://www.epa.gov/f");

    @Test
    @DisplayName("도메인 그룹: 마지막 두 라벨, arcgis는 한 그룹, 최초 등장 순")
    void groups_by_domain_with_arcgis_bucket() {
        LinkedHashMap<String, List<String>> g = UrlGrouper.group(URLS, GroupBy.DOMAIN);

        assertThat(g.keySet()).containsExactly("epa.gov", "noaa.gov", "arcgis");
        assertThat(g.get("epa.gov")).containsExactly(
                "https://www.epa.gov/a", "https://epa.gov/c", "https://www.epa.gov/f");
        assertThat(g.get("arcgis")).containsExactly(
                "https://services.arcgis.com/d", "https://foo.maps.arcgis.com/e");
    }

    @Test
    void groups_by_full_host() {
        LinkedHashMap<String, List<String>> g = UrlGrouper.group(URLS, GroupBy.HOST);

        assertThat(g.keySet()).containsExactly(
                "www.epa.gov", "x.noaa.gov", "epa.gov", "services.arcgis.com", "foo.maps.arcgis.com");
        assertThat(g.get("www.epa.gov")).hasSize(2);
    }

    @Test
    void flattened_groups_are_a_permutation_of_the_input() {
        for (GroupBy by : GroupBy.values()) {
            List<String> flat = new ArrayList<>();
            UrlGrouper.group(URLS, by).values().forEach(flat::addAll);
            assertThat(flat).containsExactlyInAnyOrderElementsOf(URLS);
        }
    }

    @Test
    void host_key_is_lowercase_without_port_or_userinfo() {
        assertThat(UrlGrouper.keyOf("http://user:pw@WWW.Example.ORG:8080/x", GroupBy.HOST))
                .isEqualTo("www.example.org");
        assertThat(UrlGrouper.keyOf("http://WWW.Example.ORG:8080/x", GroupBy.DOMAIN))
                .isEqualTo("example.org");
    }

    @Test
    void empty_input_gives_empty_map() {
        assertThat(UrlGrouper.group(List.of(), GroupBy.DOMAIN)).isEmpty();
    }

    @Test
    void url_without_hostname_fails_the_whole_call() {
        List<String> bad = List.of("https://ok.gov/a", "not a url");

        assertThatThrownBy(() -> UrlGrouper.group(bad, GroupBy.DOMAIN))
                .isInstanceOf(InvalidHostnameException.class)
                .hasMessage("No hostname: \"not a url\"");
    }

    @Test
    void file_url_has_no_hostname() {
        assertThatThrownBy(() -> UrlGrouper.keyOf("file:///tmp/x", GroupBy.HOST))
                .isInstanceOfSatisfying(InvalidHostnameException.class,
                        e -> assertThat(e.getUrl()).isEqualTo("file:///tmp/x"));
    }
}
