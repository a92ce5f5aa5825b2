package com.seedforge.core.precheck;

import com.seedforge.core.api.IHostProbe;
import com.seedforge.core.http.ConnectionErrorClassifier;
import com.seedforge.core.http.HttpHostProbe;
import com.seedforge.core.model.GroupBy;
import com.seedforge.core.model.PrecheckEntry;
import com.seedforge.core.model.PrecheckResult;
import com.seedforge.core.model.SeedConfig;
import com.seedforge.core.model.Verdict;
import com.seedforge.core.seeds.UrlGrouper;
import com.seedforge.core.util.ProgressListener;
import com.seedforge.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 호스트 도달성 프리체크:
 *  - URL을 호스트별로 묶고, 호스트마다 처음 본 URL 하나만 프로브
 *  - 고정 워커 풀(동시성=concurrency). 워커마다 자기 프로브(=HttpClient) 인스턴스를 소유
 *  - 결과는 호출 스레드 하나가 모아 로그에 쓴다(동시 쓰기 없음)
 *  - 최종 순서는 호스트 최초 등장 순으로 재구성 → 완료 순서와 무관
 *
 * 개별 프로브 실패는 판정 데이터일 뿐 전체를 중단시키지 않는다. 전역 타임아웃 없음.
 */
public final class Prechecker {

    private static final Logger LOG = LoggerFactory.getLogger(Prechecker.class);
    private static final StructuredLog SLOG = StructuredLog.get(Prechecker.class);

    public static final int DEFAULT_CONCURRENCY = 5;

    private final int concurrency;
    private final Supplier<? extends IHostProbe> probeFactory;
    private final PrecheckExemptions exemptions;
    private final Clock clock;
    private final PrecheckStats stats = new PrecheckStats();

    /** 기본 구현: 워커마다 HttpHostProbe */
    public Prechecker(SeedConfig.PrecheckCfg cfg) {
        this(cfg.getConcurrency(), () -> new HttpHostProbe(cfg),
                PrecheckExemptions.parse(cfg.getExemptions()), Clock.systemUTC());
    }

    /** DI/테스트용 */
    public Prechecker(int concurrency,
                      Supplier<? extends IHostProbe> probeFactory,
                      PrecheckExemptions exemptions,
                      Clock clock) {
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        this.concurrency = concurrency;
        this.probeFactory = Objects.requireNonNull(probeFactory, "probeFactory");
        this.exemptions = (exemptions == null ? PrecheckExemptions.NONE : exemptions);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public PrecheckResult precheck(Iterable<String> urls) {
        return precheck(urls, ProgressListener.NONE);
    }

    public PrecheckResult precheck(Iterable<String> urls, ProgressListener listener) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        LinkedHashMap<String, List<String>> hostGroups = UrlGrouper.group(urls, GroupBy.HOST);

        LOG.info("Pre-checking {} hosts for connection failures...", hostGroups.size());
        SLOG.info("precheck-start", "hosts", hostGroups.size(), "cc", concurrency);

        // ---- 0) 면제 호스트는 프로브 없이 통과 ----
        Map<String, Verdict> verdicts = new HashMap<>();
        Map<String, Instant> checkedAt = new HashMap<>();
        Deque<Job> jobs = new ArrayDeque<>();
        for (Map.Entry<String, List<String>> e : hostGroups.entrySet()) {
            String host = e.getKey();
            String representative = e.getValue().get(0);
            if (exemptions.isExempt(host, representative)) {
                verdicts.put(host, Verdict.REACHABLE);
                checkedAt.put(host, now());
                LOG.info("⏭ {} (exempt)", host);
            } else {
                jobs.add(new Job(host, representative));
            }
        }

        final int total = jobs.size();
        pl.onProgress(0.0, "precheck", 0, total);
        if (total > 0) {
            runProbes(jobs, verdicts, checkedAt, pl);
        }

        // ---- 결과 조립: 호스트 최초 등장 순 ----
        List<String> reachable = new ArrayList<>();
        LinkedHashMap<String, PrecheckEntry> log = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : hostGroups.entrySet()) {
            String host = e.getKey();
            Verdict v = verdicts.getOrDefault(host, Verdict.UNCLASSIFIED);
            log.put(host, new PrecheckEntry(checkedAt.getOrDefault(host, now()), v, e.getValue()));
            if (!v.isUnreachable()) reachable.addAll(e.getValue());
        }

        PrecheckResult result = new PrecheckResult(reachable, log);
        LOG.info("Pre-check done. hosts={}, unreachable={}, keptUrls={}",
                hostGroups.size(), result.unreachableHostCount(), reachable.size());
        SLOG.info("precheck-done",
                "hosts", hostGroups.size(),
                "unreachable", result.unreachableHostCount(),
                "keptUrls", reachable.size(),
                "maxObservedCC", stats.snapshot().maxObservedConcurrency);
        return result;
    }

    private void runProbes(Deque<Job> jobs,
                           Map<String, Verdict> verdicts,
                           Map<String, Instant> checkedAt,
                           ProgressListener pl) {
        final int total = jobs.size();
        final int workers = Math.min(concurrency, total);
        final ConcurrentLinkedQueue<Job> queue = new ConcurrentLinkedQueue<>(jobs);
        final BlockingQueue<Outcome> outcomes = new LinkedBlockingQueue<>();
        final AtomicInteger inFlight = new AtomicInteger(0);

        ExecutorService exec = Executors.newFixedThreadPool(workers, new NamedThreadFactory("precheck-worker"));
        List<Future<?>> workerFutures = new ArrayList<>(workers);
        try {
            // ---- 1) 워커 N개: 각자 프로브 인스턴스를 만들어 큐가 빌 때까지 소비 ----
            for (int i = 0; i < workers; i++) {
                workerFutures.add(exec.submit(() -> {
                    IHostProbe probe = probeFactory.get();
                    Job job;
                    while ((job = queue.poll()) != null) {
                        if (Thread.currentThread().isInterrupted()) return null;
                        outcomes.add(probeOne(probe, job, inFlight));
                    }
                    return null;
                }));
            }

            // ---- 2) 결과 수집(이 스레드만 맵에 쓴다) ----
            int done = 0;
            while (done < total) {
                Outcome o = outcomes.poll(250, TimeUnit.MILLISECONDS);
                if (o == null) {
                    failIfWorkersDied(workerFutures, outcomes);
                    continue;
                }
                done++;
                verdicts.put(o.host, o.verdict);
                checkedAt.put(o.host, now());
                if (o.verdict.isUnreachable()) {
                    LOG.info("❌ {} (Error: {})", o.host, o.verdict.wireName());
                } else {
                    LOG.info("✅ {}", o.host);
                }
                SLOG.debug("host-checked", "host", o.host, "error", o.verdict.wireName(), "verdict", o.verdict.name());
                pl.onProgress(Math.min(1.0, (double) done / total), "precheck", done, total);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while collecting precheck results");
        } finally {
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private Outcome probeOne(IHostProbe probe, Job job, AtomicInteger inFlight) throws InterruptedException {
        int cur = inFlight.incrementAndGet();
        stats.observeConcurrency(cur);
        long t0 = System.nanoTime();
        Verdict v;
        try {
            v = probe.probe(job.representative);
            if (v == null) v = Verdict.UNCLASSIFIED;
        } catch (InterruptedException ie) {
            throw ie;
        } catch (Exception e) {
            v = ConnectionErrorClassifier.classify(e);
            if (v == Verdict.UNCLASSIFIED) {
                LOG.debug("Unclassified probe failure for {}: {}", job.host, e.toString());
            }
        } finally {
            inFlight.decrementAndGet();
        }
        long wallMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
        int retries = (probe instanceof HttpHostProbe hp) ? hp.lastRetryCount() : 0;
        stats.addProbe(wallMs, retries);
        return new Outcome(job.host, v);
    }

    /** 결과가 안 오는데 워커가 모두 끝났다면 워커 쪽 예외를 드러낸다 */
    private static void failIfWorkersDied(List<Future<?>> workers, BlockingQueue<Outcome> outcomes) {
        for (Future<?> f : workers) {
            if (!f.isDone()) return;
        }
        if (!outcomes.isEmpty()) return;
        for (Future<?> f : workers) {
            try {
                f.get();
            } catch (ExecutionException e) {
                Throwable cause = (e.getCause() != null ? e.getCause() : e);
                SLOG.error("worker-failed", cause, "cause", cause.toString());
                throw new IllegalStateException("Precheck worker failed: " + cause, cause);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while checking precheck workers");
            }
        }
        throw new IllegalStateException("Precheck workers exited before all hosts were checked");
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    public PrecheckStats.Snapshot getRuntimeSnapshot() {
        return stats.snapshot();
    }

    public int getConcurrency() {
        return concurrency;
    }

    private record Job(String host, String representative) {}

    private record Outcome(String host, Verdict verdict) {}

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
