package com.seedforge.core.model;

/**
 * 호스트 단위 도달성 판정.
 * wireName은 precheck.log.json의 "error" 값과 1:1로 맞춰야 한다(import 단계 호환).
 */
public enum Verdict {
    REACHABLE(null),
    NAME_NOT_RESOLVED("name-not-resolved"),
    TIMEOUT("timeout"),
    CONNECTION_RESET("connection-reset"),
    /** 분류되지 않은 실패. 프로브 클라이언트 쪽 문제일 수 있어 도달 가능으로 취급 */
    UNCLASSIFIED(null);

    private final String wireName;

    Verdict(String wireName) { this.wireName = wireName; }

    /** 로그에 기록할 에러 문자열. 도달 가능으로 취급되면 null */
    public String wireName() { return wireName; }

    public boolean isUnreachable() { return wireName != null; }

    public static Verdict fromWireName(String s) {
        if (s == null) return REACHABLE;
        for (Verdict v : values()) {
            if (s.equals(v.wireName)) return v;
        }
        throw new IllegalArgumentException("Unknown precheck error: " + s);
    }
}
