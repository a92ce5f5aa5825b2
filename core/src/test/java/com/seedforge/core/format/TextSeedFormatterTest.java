package com.seedforge.core.format;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TextSeedFormatterTest {

    private final TextSeedFormatter fmt = new TextSeedFormatter();

    @Test
    void sorted_one_per_line_with_trailing_newline() {
        String out = fmt.format(List.of("https://b.gov/", "https://a.gov/x", "https://a.gov/"), FormatOptions.defaults());

        assertThat(out).isEqualTo("https://a.gov/\nhttps://a.gov/x\nhttps://b.gov/\n");
    }

    @Test
    void empty_input_is_empty_string() {
        assertThat(fmt.format(List.of(), null)).isEmpty();
    }
}
