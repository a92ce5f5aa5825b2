package com.seedforge.core.http;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 네트워크 계층 실패(DNS/연결/리셋)에서만 재시도. HTTP 상태 코드는 재시도 사유가 아니다.
 * 지연: base → 2*base → 4*base ... (±10% Jitter)
 */
public final class NetworkRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;

    /** 재시도 2회(총 3번 시도), 500ms 기준 */
    public NetworkRetryPolicy() { this(2, 500); }

    /** @param retries 첫 시도 이후 추가 시도 횟수 */
    public NetworkRetryPolicy(int retries, long baseMillis) {
        this.maxAttempts = 1 + Math.max(0, retries);
        this.baseMillis = Math.max(1, baseMillis);
    }

    @Override public boolean shouldRetry(Throwable failure, int attempt) {
        if (attempt >= maxAttempts) return false;
        return ConnectionErrorClassifier.isNetworkLevel(failure);
    }

    @Override public Duration nextDelay(int attempt) {
        long pow = 1L << Math.min(20, attempt - 1);   // 1,2,4...
        long raw = baseMillis * pow;
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2); // ±10%
        return Duration.ofMillis((long) (raw * jitter));
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
