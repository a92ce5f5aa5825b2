package com.seedforge.core.catalog;

import java.io.IOException;

/**
 * 원천 URL 목록(DB/API/파일). pattern은 와일드카드 포함 패턴 또는 null(전체).
 * 제외 패턴/무시 목록 처리는 FilteringUrlCatalog가 맡는다.
 */
@FunctionalInterface
public interface UrlSource {
    Iterable<String> fetch(String pattern) throws IOException;
}
