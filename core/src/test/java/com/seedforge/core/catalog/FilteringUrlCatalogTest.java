package com.seedforge.core.catalog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FilteringUrlCatalogTest {

    @Test
    void negated_pattern_queries_everything_and_drops_matches() throws Exception {
        List<String> queried = new ArrayList<>();
        UrlSource source = pattern -> {
            queried.add(String.valueOf(pattern));
            return List.of("https://a.gov/x", "https://b.com/y");
        };

        List<String> out = new FilteringUrlCatalog(source).getActiveUrls("!*.gov");

        assertThat(out).containsExactly("https://b.com/y");
        assertThat(queried).containsExactly("null");
    }

    @Test
    void positive_pattern_is_passed_to_the_source() throws Exception {
        List<String> queried = new ArrayList<>();
        UrlSource source = pattern -> {
            queried.add(pattern);
            return List.of("https://a.gov/x");
        };

        new FilteringUrlCatalog(source).getActiveUrls("https://a.gov/*");

        assertThat(queried).containsExactly("https://a.gov/*");
    }

    @Test
    void ignored_urls_are_removed_exactly() throws Exception {
        UrlSource source = pattern -> List.of("https://dead.gov/", "https://dead.gov/x", "https://ok.gov/");

        List<String> out = new FilteringUrlCatalog(source, List.of("https://dead.gov/")).getActiveUrls(null);

        assertThat(out).containsExactly("https://dead.gov/x", "https://ok.gov/");
    }

    @Test
    void file_source_skips_comments_and_applies_pattern(@TempDir Path dir) throws Exception {
        Path f = dir.resolve("urls.txt");
        Files.writeString(f, "# seeds\nhttps://a.gov/1\n\n  https://b.org/2  \nhttps://c.gov/3\n");
        FilteringUrlCatalog catalog = new FilteringUrlCatalog(new FileUrlSource(f));

        assertThat(catalog.getActiveUrls(null)).containsExactly("https://a.gov/1", "https://b.org/2", "https://c.gov/3");
        assertThat(catalog.getActiveUrls("*.gov")).containsExactly("https://a.gov/1", "https://c.gov/3");
        assertThat(catalog.getActiveUrls("!*.gov")).containsExactly("https://b.org/2");
    }

    @Test
    void missing_file_is_io_error(@TempDir Path dir) {
        FileUrlSource src = new FileUrlSource(dir.resolve("missing.txt"));
        assertThatThrownBy(() -> src.fetch(null)).isInstanceOf(IOException.class);
    }
}
