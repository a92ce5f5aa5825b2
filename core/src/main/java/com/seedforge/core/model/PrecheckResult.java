package com.seedforge.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 프리체크 결과: 남길 URL(호스트 최초 등장 순) + 호스트별 로그 */
public record PrecheckResult(List<String> reachable, Map<String, PrecheckEntry> log) {
    public PrecheckResult {
        reachable = List.copyOf(reachable);
        log = Collections.unmodifiableMap(new LinkedHashMap<>(log));
    }

    public long unreachableHostCount() {
        return log.values().stream().filter(PrecheckEntry::isUnreachable).count();
    }
}
