package com.seedforge.core.api;

import com.seedforge.core.format.FormatOptions;

/** 정렬된 URL 시퀀스 + 옵션 → 시드 문서 문자열 */
@FunctionalInterface
public interface ISeedFormatter {
    String format(Iterable<String> urls, FormatOptions options);
}
