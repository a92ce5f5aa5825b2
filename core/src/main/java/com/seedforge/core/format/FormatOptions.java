package com.seedforge.core.format;

import com.seedforge.core.model.SeedConfig;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 포맷터 옵션: 워커 수, 저장 상태 개수, 페이지 타임아웃, 임의 덮어쓰기 옵션, 운영자 연락처.
 * saveStateHistory는 지정하지 않으면 workers와 같다.
 */
public final class FormatOptions {
    private int workers = 4;
    private Integer saveStateHistory;
    private int pageLoadTimeout = 120;
    private long rolloverSize = 8_000_000_000L;
    private String operator = SeedConfig.DEFAULT_OPERATOR;
    private Map<String, Object> overrides = new LinkedHashMap<>();

    public static FormatOptions defaults() { return new FormatOptions(); }

    /** 설정의 browsertrix 섹션 + 워커 수로 옵션 구성 */
    public static FormatOptions from(SeedConfig.BrowsertrixCfg cfg, int workers) {
        Objects.requireNonNull(cfg, "cfg");
        return new FormatOptions()
                .setWorkers(workers)
                .setPageLoadTimeout(cfg.getPageLoadTimeout())
                .setRolloverSize(cfg.getRolloverSize())
                .setOperator(cfg.getOperator())
                .setOverrides(cfg.getOptions());
    }

    /** 같은 옵션에 워커 수만 바꾼 사본 */
    public FormatOptions withWorkers(int w) {
        return new FormatOptions()
                .setWorkers(w)
                .setSaveStateHistory(saveStateHistory)
                .setPageLoadTimeout(pageLoadTimeout)
                .setRolloverSize(rolloverSize)
                .setOperator(operator)
                .setOverrides(overrides);
    }

    public int getWorkers() { return workers; }
    public FormatOptions setWorkers(int v) { this.workers = v; return this; }

    public int getSaveStateHistory() { return saveStateHistory != null ? saveStateHistory : workers; }
    public FormatOptions setSaveStateHistory(Integer v) { this.saveStateHistory = v; return this; }

    public int getPageLoadTimeout() { return pageLoadTimeout; }
    public FormatOptions setPageLoadTimeout(int v) { this.pageLoadTimeout = v; return this; }

    public long getRolloverSize() { return rolloverSize; }
    public FormatOptions setRolloverSize(long v) { this.rolloverSize = v; return this; }

    public String getOperator() { return operator; }
    public FormatOptions setOperator(String v) { this.operator = v; return this; }

    public Map<String, Object> getOverrides() { return overrides; }
    public FormatOptions setOverrides(Map<String, Object> m) {
        this.overrides = (m == null ? new LinkedHashMap<>() : new LinkedHashMap<>(m));
        return this;
    }
}
