package com.seedforge.core.catalog;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/** 줄 단위 URL 파일. 빈 줄과 '#' 주석 줄은 건너뛴다. */
public final class FileUrlSource implements UrlSource {
    private static final Logger LOG = Logger.getLogger(FileUrlSource.class.getName());

    private final Path file;

    public FileUrlSource(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public List<String> fetch(String pattern) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("URL list not found at: " + file.toAbsolutePath());
        }
        WildcardPattern p = WildcardPattern.parse(pattern);
        List<String> out = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String s = line.trim();
            if (s.isEmpty() || s.startsWith("#")) continue;
            if (p != null && !p.accepts(s)) continue;
            out.add(s);
        }
        LOG.fine(() -> "Read " + out.size() + " URLs from " + file);
        return out;
    }
}
