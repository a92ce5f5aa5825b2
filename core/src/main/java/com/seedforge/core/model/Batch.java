package com.seedforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * 시드 파일 하나 분량의 URL 묶음.
 * workers: 크롤 설정 힌트(단일 대형 도메인 청크는 1).
 */
public final class Batch {
    private final String name;
    private final List<String> urls;
    private final int workers;

    public Batch(String name, List<String> urls, int workers) {
        this.name = Objects.requireNonNull(name, "name");
        this.urls = List.copyOf(Objects.requireNonNull(urls, "urls"));
        this.workers = workers;
    }

    public String getName() { return name; }
    public List<String> getUrls() { return urls; }
    public int getWorkers() { return workers; }
    public int size() { return urls.size(); }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Batch b)) return false;
        return workers == b.workers && name.equals(b.name) && urls.equals(b.urls);
    }

    @Override public int hashCode() { return Objects.hash(name, urls, workers); }

    @Override public String toString() {
        return "Batch{name=" + name + ", size=" + urls.size() + ", workers=" + workers + "}";
    }
}
