package com.seedforge.core.service.importer;

import java.util.Map;

/** import 결과: 넘긴 레코드 수 + 잡별 오류 건수 */
public record ImportSummary(int records, Map<String, Integer> errorsByJob) {
    public ImportSummary {
        errorsByJob = Map.copyOf(errorsByJob);
    }

    public int totalErrors() {
        return errorsByJob.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean hasErrors() { return totalErrors() > 0; }
}
