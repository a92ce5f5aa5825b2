package com.seedforge.core.precheck;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 프리체크 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class PrecheckStats {
    private final AtomicLong probesTotal   = new AtomicLong(0);   // 호스트 프로브 수
    private final AtomicLong retriesTotal  = new AtomicLong(0);   // 재시도 횟수 총합
    private final AtomicLong sumWallMs     = new AtomicLong(0);   // 프로브별 벽시계 합
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void addProbe(long wallMs, int retries) {
        probesTotal.incrementAndGet();
        retriesTotal.addAndGet(retries);
        sumWallMs.addAndGet(wallMs);
    }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        long n = probesTotal.get();
        long avg = sumWallMs.get() / Math.max(1, n);
        return new Snapshot(n, retriesTotal.get(), maxObservedConcurrency.get(), avg);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long probesTotal;
        public final long retriesTotal;
        public final int  maxObservedConcurrency;
        public final long avgProbeMs;
        public Snapshot(long p, long r, int c, long a) {
            this.probesTotal = p;
            this.retriesTotal = r;
            this.maxObservedConcurrency = c;
            this.avgProbeMs = a;
        }
    }
}
