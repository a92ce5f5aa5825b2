package com.seedforge.core.http;

import com.seedforge.core.model.SeedConfig;
import com.seedforge.core.model.Verdict;
import com.seedforge.core.util.Sleeper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLHandshakeException;
import javax.net.ssl.SSLSession;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.SocketException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class HttpHostProbeTest {

    /** sleep(Duration) 호출 기록 */
    static class TestSleeper implements Sleeper {
        final List<Duration> sleeps = new ArrayList<>();
        @Override public void sleep(Duration d) { sleeps.add(d); }
    }

    /** 본문 없는 HttpResponse */
    static class Resp implements HttpResponse<Void> {
        final int code;
        Resp(int code) { this.code = code; }
        @Override public int statusCode() { return code; }
        @Override public HttpRequest request() { return null; }
        @Override public Optional<HttpResponse<Void>> previousResponse() { return Optional.empty(); }
        @Override public HttpHeaders headers() { return HttpHeaders.of(Map.of(), (a, b) -> true); }
        @Override public Void body() { return null; }
        @Override public Optional<SSLSession> sslSession() { return Optional.empty(); }
        @Override public URI uri() { return URI.create("https://example.gov"); }
        @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
    }

    private final SeedConfig.PrecheckCfg cfg = new SeedConfig.PrecheckCfg();
    private final TestSleeper sleeper = new TestSleeper();

    private HttpHostProbe probe(HttpHostProbe.HttpSender sender) {
        return new HttpHostProbe(cfg, sender, new NetworkRetryPolicy(2, 100), sleeper);
    }

    @Test
    void dns_failure_is_retried_then_reported() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        HttpHostProbe p = probe(req -> {
            calls.incrementAndGet();
            throw new UnknownHostException(req.uri().getHost());
        });

        assertThat(p.probe("https://gone.example.gov/x")).isEqualTo(Verdict.NAME_NOT_RESOLVED);
        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeper.sleeps).hasSize(2);
        assertThat(p.lastRetryCount()).isEqualTo(2);
    }

    @Test
    void transient_reset_then_success_is_reachable() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        HttpHostProbe p = probe(req -> {
            if (calls.incrementAndGet() == 1) throw new SocketException("Connection reset");
            return new Resp(200);
        });

        assertThat(p.probe("https://flaky.example.gov/")).isEqualTo(Verdict.REACHABLE);
        assertThat(calls.get()).isEqualTo(2);
        assertThat(p.lastRetryCount()).isEqualTo(1);
    }

    @Test
    void refused_connection_is_retried_but_treated_as_reachable() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        HttpHostProbe p = probe(req -> {
            calls.incrementAndGet();
            throw new ConnectException("Connection refused");
        });

        assertThat(p.probe("https://closed.example.gov/")).isEqualTo(Verdict.UNCLASSIFIED);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void tls_failure_is_not_retried() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        HttpHostProbe p = probe(req -> {
            calls.incrementAndGet();
            throw new SSLHandshakeException("handshake_failure");
        });

        assertThat(p.probe("https://tls.example.gov/")).isEqualTo(Verdict.UNCLASSIFIED);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    void sends_full_get_with_user_agent() throws Exception {
        AtomicReference<HttpRequest> seen = new AtomicReference<>();
        cfg.setUserAgent("SeedForgeTest/1.0");
        HttpHostProbe p = probe(req -> { seen.set(req); return new Resp(404); });

        assertThat(p.probe("https://ok.example.gov/page")).isEqualTo(Verdict.REACHABLE);
        assertThat(seen.get().method()).isEqualTo("GET");
        assertThat(seen.get().headers().firstValue("User-Agent")).contains("SeedForgeTest/1.0");
        assertThat(seen.get().timeout()).contains(cfg.getReadTimeout());
    }

    @Test
    void unparseable_url_is_unclassified() throws Exception {
        HttpHostProbe p = probe(req -> { throw new AssertionError("must not send"); });
        assertThat(p.probe("http://bad host.gov/ x")).isEqualTo(Verdict.UNCLASSIFIED);
    }

    @Test
    void server_error_status_still_counts_as_reachable() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", ex -> {
            byte[] body = "oops".getBytes();
            ex.sendResponseHeaders(500, body.length);
            ex.getResponseBody().write(body);
            ex.close();
        });
        server.start();
        try {
            cfg.setConnectTimeout(Duration.ofSeconds(5)).setReadTimeout(Duration.ofSeconds(5));
            HttpHostProbe real = new HttpHostProbe(cfg);
            String url = "http://127.0.0.1:" + server.getAddress().getPort() + "/x";

            assertThat(real.probe(url)).isEqualTo(Verdict.REACHABLE);
            assertThat(real.lastRetryCount()).isZero();
        } finally {
            server.stop(0);
        }
    }
}
