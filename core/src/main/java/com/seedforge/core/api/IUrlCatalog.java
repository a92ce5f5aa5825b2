package com.seedforge.core.api;

import java.io.IOException;

/**
 * 모니터링 중인(active) URL 카탈로그.
 * pattern: null이면 전체, "!"로 시작하면 제외 패턴, 그 외는 와일드카드(*) 포함 패턴.
 */
@FunctionalInterface
public interface IUrlCatalog {
    Iterable<String> getActiveUrls(String pattern) throws IOException;
}
