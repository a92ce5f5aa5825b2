package com.seedforge.core.http;

import com.seedforge.core.model.Verdict;

import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import javax.net.ssl.SSLException;
import java.util.Locale;

/**
 * 프로브 예외 → 판정 매핑. 로그 호환을 위해 세 가지 네트워크 오류만 이름을 붙인다.
 * <ul>
 *   <li>DNS 해석 실패 → name-not-resolved</li>
 *   <li>연결 단계 타임아웃 → timeout</li>
 *   <li>요청 도중 상대가 연결을 끊음 → connection-reset</li>
 *   <li>그 외(TLS 포함) → UNCLASSIFIED (도달 가능 취급)</li>
 * </ul>
 * 예외는 cause 체인 전체를 본다(HttpClient가 ConnectException으로 감싸는 경우가 많음).
 */
public final class ConnectionErrorClassifier {
    private ConnectionErrorClassifier() {}

    private static final int MAX_DEPTH = 16;

    public static Verdict classify(Throwable failure) {
        if (failure == null) return Verdict.REACHABLE;
        if (anyInChain(failure, ConnectionErrorClassifier::isNameResolution)) return Verdict.NAME_NOT_RESOLVED;
        // TLS 단계에서 난 리셋/타임아웃은 프로브 클라이언트 문제일 수 있다
        if (anyInChain(failure, t -> t instanceof SSLException)) return Verdict.UNCLASSIFIED;
        if (anyInChain(failure, ConnectionErrorClassifier::isConnectTimeout)) return Verdict.TIMEOUT;
        if (anyInChain(failure, ConnectionErrorClassifier::isReset)) return Verdict.CONNECTION_RESET;
        return Verdict.UNCLASSIFIED;
    }

    /** 재시도 대상인 네트워크 계층 실패인지: 분류된 세 가지 + 연결 거부/경로 없음 */
    public static boolean isNetworkLevel(Throwable failure) {
        if (failure == null) return false;
        if (classify(failure) != Verdict.UNCLASSIFIED) return true;
        return anyInChain(failure, t -> t instanceof ConnectException || t instanceof NoRouteToHostException);
    }

    private static boolean isNameResolution(Throwable t) {
        return t instanceof UnknownHostException || t instanceof UnresolvedAddressException;
    }

    private static boolean isConnectTimeout(Throwable t) {
        if (t instanceof HttpConnectTimeoutException) return true;
        if (t instanceof SocketTimeoutException) {
            return message(t).contains("connect");
        }
        return false;
    }

    private static boolean isReset(Throwable t) {
        if (!(t instanceof IOException)) return false;
        String m = message(t);
        return m.contains("connection reset")
                || m.contains("closed connection")
                || m.contains("connection closed")
                || m.contains("eof reached")
                || m.contains("received no bytes")
                || m.contains("broken pipe");
    }

    private static String message(Throwable t) {
        return t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
    }

    private static boolean anyInChain(Throwable t, java.util.function.Predicate<Throwable> p) {
        int depth = 0;
        for (Throwable cur = t; cur != null && depth < MAX_DEPTH; cur = cur.getCause(), depth++) {
            if (p.test(cur)) return true;
            if (cur.getCause() == cur) break;
        }
        return false;
    }
}
