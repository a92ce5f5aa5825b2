package com.seedforge.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 시드 생성 설정 (seeds.yml 매핑 대상). 순수 설정 보관용.
 * CLI 플래그는 로드 후 세터로 덮어쓴다.
 */
public final class SeedConfig {

    public static final String DEFAULT_OPERATOR =
            "\"Environmental Data & Governance Initiative\" <contact@envirodatagov.org>";

    /** 프리체크 하위 설정: YAML의 `precheck:` 섹션과 매핑 */
    public static final class PrecheckCfg {
        /** 동시 프로브 상한 (기본 5) */
        private int concurrency = 5;
        /** 느린 서버가 있어 연결 단계 예산은 넉넉하게 */
        private Duration connectTimeout = Duration.ofSeconds(60);
        private Duration readTimeout = Duration.ofSeconds(10);
        /** 네트워크 오류에 대한 추가 시도 횟수 (기본 2) */
        private int retries = 2;
        private long backoffMs = 500;
        private String userAgent = "SeedForge-Precheck/0.3 (+https://envirodatagov.org)";
        private List<String> exemptions = List.of();

        public int getConcurrency() { return concurrency; }
        public PrecheckCfg setConcurrency(int v) { this.concurrency = Math.max(1, v); return this; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public PrecheckCfg setConnectTimeout(Duration d) { this.connectTimeout = d; return this; }

        public Duration getReadTimeout() { return readTimeout; }
        public PrecheckCfg setReadTimeout(Duration d) { this.readTimeout = d; return this; }

        public int getRetries() { return retries; }
        public PrecheckCfg setRetries(int v) { this.retries = Math.max(0, v); return this; }

        public long getBackoffMs() { return backoffMs; }
        public PrecheckCfg setBackoffMs(long v) { this.backoffMs = Math.max(1, v); return this; }

        public String getUserAgent() { return userAgent; }
        public PrecheckCfg setUserAgent(String ua) { this.userAgent = ua; return this; }

        public List<String> getExemptions() { return exemptions; }
        public PrecheckCfg setExemptions(List<String> list) {
            this.exemptions = (list == null ? List.of() : List.copyOf(list));
            return this;
        }
    }

    /** 패킹 하위 설정: YAML의 `packing:` 섹션 */
    public static final class PackingCfg {
        private int size = 1000;
        /** 0이면 size와 동일 */
        private int singleGroupSize = 0;
        private int workers = 2;

        public int getSize() { return size; }
        public PackingCfg setSize(int v) { this.size = v; return this; }

        public int getSingleGroupSize() { return singleGroupSize; }
        public PackingCfg setSingleGroupSize(int v) { this.singleGroupSize = v; return this; }

        /** 실제 분할 크기: singleGroupSize가 비어 있으면 size */
        public int effectiveSingleGroupSize() { return singleGroupSize > 0 ? singleGroupSize : size; }

        public int getWorkers() { return workers; }
        public PackingCfg setWorkers(int v) { this.workers = v; return this; }
    }

    /** Browsertrix 크롤 설정 문서 기본값: YAML의 `browsertrix:` 섹션 */
    public static final class BrowsertrixCfg {
        private String operator = DEFAULT_OPERATOR;
        private int pageLoadTimeout = 120;
        private long rolloverSize = 8_000_000_000L;
        private Map<String, Object> options = new LinkedHashMap<>();

        public String getOperator() { return operator; }
        public BrowsertrixCfg setOperator(String v) { this.operator = v; return this; }

        public int getPageLoadTimeout() { return pageLoadTimeout; }
        public BrowsertrixCfg setPageLoadTimeout(int v) { this.pageLoadTimeout = v; return this; }

        public long getRolloverSize() { return rolloverSize; }
        public BrowsertrixCfg setRolloverSize(long v) { this.rolloverSize = v; return this; }

        public Map<String, Object> getOptions() { return options; }
        public BrowsertrixCfg setOptions(Map<String, Object> m) {
            this.options = (m == null ? new LinkedHashMap<>() : new LinkedHashMap<>(m));
            return this;
        }
    }

    private final PrecheckCfg precheck = new PrecheckCfg();
    private final PackingCfg packing = new PackingCfg();
    private final BrowsertrixCfg browsertrix = new BrowsertrixCfg();

    /** 카탈로그에서 빼 둘 URL(죽은 서버, 404 고정 등). 운영 데이터라 설정으로 관리 */
    private List<String> ignoreUrls = List.of();
    private Path outputDir = Path.of(".");

    // ---------- getters ----------
    public PrecheckCfg precheck() { return precheck; }
    public PackingCfg packing() { return packing; }
    public BrowsertrixCfg browsertrix() { return browsertrix; }
    public List<String> getIgnoreUrls() { return ignoreUrls; }
    public Path getOutputDir() { return outputDir; }

    // ---------- fluent setters ----------
    public SeedConfig setIgnoreUrls(List<String> urls) {
        this.ignoreUrls = (urls == null ? List.of() : List.copyOf(urls));
        return this;
    }
    public SeedConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }

    // ---------- validate ----------
    public void validate() {
        if (precheck.getConcurrency() < 1) throw new IllegalArgumentException("precheck.concurrency must be >= 1");
        requirePositive(precheck.getConnectTimeout(), "precheck.connectTimeoutMs");
        requirePositive(precheck.getReadTimeout(), "precheck.readTimeoutMs");
        if (precheck.getRetries() < 0) throw new IllegalArgumentException("precheck.retries must be >= 0");

        if (packing.getSize() < 1) throw new IllegalArgumentException("packing.size must be >= 1");
        if (packing.getSingleGroupSize() < 0) throw new IllegalArgumentException("packing.singleGroupSize must be >= 0");
        if (packing.getWorkers() < 1) throw new IllegalArgumentException("packing.workers must be >= 1");

        if (browsertrix.getPageLoadTimeout() < 1)
            throw new IllegalArgumentException("browsertrix.pageLoadTimeout must be >= 1");
        Objects.requireNonNull(browsertrix.getOperator(), "browsertrix.operator");
        Objects.requireNonNull(outputDir, "outputDir");
    }

    private static void requirePositive(Duration d, String key) {
        if (d == null || d.isNegative() || d.isZero())
            throw new IllegalArgumentException(key + " must be > 0");
    }

    public static SeedConfig defaults() { return new SeedConfig(); }
}
