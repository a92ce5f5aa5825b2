package com.seedforge.core.http;

import com.seedforge.core.api.IHostProbe;
import com.seedforge.core.model.SeedConfig;
import com.seedforge.core.model.Verdict;
import com.seedforge.core.util.DefaultSleeper;
import com.seedforge.core.util.Sleeper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 실제 GET(본문까지 수신 후 폐기)으로 호스트 도달성을 확인.
 * HEAD 같은 가벼운 확인은 일부 서버가 잘못 응답해서 쓰지 않는다.
 * HTTP 상태 코드와 무관하게 응답이 오면 REACHABLE(호스트가 대답했다는 뜻).
 *
 * 인스턴스마다 자체 HttpClient를 가진다. 워커 스레드 하나가 인스턴스 하나를 소유한다.
 */
public class HttpHostProbe implements IHostProbe {
    private static final Logger LOG = Logger.getLogger(HttpHostProbe.class.getName());

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<Void> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final Duration readTimeout;
    private final String userAgent;
    private final HttpSender sender;
    private final RetryPolicy policy;
    private final Sleeper sleeper;

    private int lastRetryCount = 0;

    public HttpHostProbe(SeedConfig.PrecheckCfg cfg) {
        this(cfg, clientSender(cfg),
                new NetworkRetryPolicy(cfg.getRetries(), cfg.getBackoffMs()),
                new DefaultSleeper());
    }

    /** 송신 훅/정책/슬리퍼 주입(테스트용) */
    public HttpHostProbe(SeedConfig.PrecheckCfg cfg, HttpSender sender, RetryPolicy policy, Sleeper sleeper) {
        Objects.requireNonNull(cfg, "cfg");
        this.readTimeout = cfg.getReadTimeout();
        this.userAgent = cfg.getUserAgent();
        this.sender = Objects.requireNonNull(sender, "sender");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    private static HttpSender clientSender(SeedConfig.PrecheckCfg cfg) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(cfg.getConnectTimeout())
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.discarding());
    }

    @Override
    public Verdict probe(String url) throws InterruptedException {
        lastRetryCount = 0;
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            // 호스트는 뽑혔지만 URI로는 안 되는 경우: 클라이언트 한계일 뿐이므로 도달 가능 취급
            LOG.log(Level.FINE, "Unprobeable URL, treating as reachable: " + url, e);
            return Verdict.UNCLASSIFIED;
        }

        HttpRequest.Builder b = HttpRequest.newBuilder(uri).timeout(readTimeout).GET();
        if (userAgent != null && !userAgent.isBlank()) b.header("User-Agent", userAgent);
        HttpRequest req;
        try {
            req = b.build();
        } catch (IllegalArgumentException e) {
            LOG.log(Level.FINE, "Unsupported URL for probe: " + url, e);
            return Verdict.UNCLASSIFIED;
        }

        CountingRetryPolicy counting = new CountingRetryPolicy(policy);
        int attempt = 1;
        try {
            while (true) {
                try {
                    HttpResponse<Void> resp = sender.send(req);
                    LOG.fine(() -> "Probe " + url + " -> " + resp.statusCode());
                    return Verdict.REACHABLE;
                } catch (IOException e) {
                    if (!counting.shouldRetry(e, attempt)) {
                        Verdict v = ConnectionErrorClassifier.classify(e);
                        if (v == Verdict.UNCLASSIFIED) {
                            LOG.log(Level.FINE, "Unclassified probe failure for " + url + ": " + e, e);
                        }
                        return v;
                    }
                    sleeper.sleep(counting.nextDelay(attempt));
                    attempt++;
                }
            }
        } catch (RuntimeException e) {
            LOG.log(Level.FINE, "Probe client error for " + url + ": " + e, e);
            return Verdict.UNCLASSIFIED;
        } finally {
            lastRetryCount = counting.getRetryCount();
        }
    }

    /** 직전 probe 호출에서 실제 발생한 재시도 횟수 */
    public int lastRetryCount() {
        return lastRetryCount;
    }
}
