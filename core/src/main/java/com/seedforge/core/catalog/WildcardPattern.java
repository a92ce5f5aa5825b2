package com.seedforge.core.catalog;

import java.util.regex.Pattern;

/**
 * 카탈로그 패턴: '*' → ".*", 문자열 전체 매치(앵커). 나머지 정규식 메타문자는 이스케이프.
 * "!"로 시작하면 제외 패턴.
 * URL 전체 또는 origin(scheme://host[:port])에 전체 일치하면 매치로 본다.
 * 예: "*.gov" 는 https://a.gov/x 와 매치(origin 기준).
 */
public final class WildcardPattern {
    private final Pattern regex;
    private final boolean negated;
    private final String source;

    private WildcardPattern(String source, Pattern regex, boolean negated) {
        this.source = source;
        this.regex = regex;
        this.negated = negated;
    }

    /** null/빈 문자열이면 null(필터 없음) */
    public static WildcardPattern parse(String pattern) {
        if (pattern == null || pattern.isEmpty()) return null;
        boolean neg = pattern.startsWith("!");
        String body = neg ? pattern.substring(1) : pattern;
        return new WildcardPattern(pattern, Pattern.compile(globToRegex(body)), neg);
    }

    /** 패턴 본문(부정 여부와 무관)에 URL이 완전히 일치하는지 */
    public boolean matchesBody(String url) {
        if (url == null) return false;
        if (regex.matcher(url).matches()) return true;
        String origin = originOf(url);
        return origin != null && regex.matcher(origin).matches();
    }

    /** "https://a.gov/x?y" → "https://a.gov". 경로가 없으면 null */
    static String originOf(String url) {
        int sep = url.indexOf("://");
        if (sep <= 0) return null;
        for (int i = sep + 3; i < url.length(); i++) {
            char c = url.charAt(i);
            if (c == '/' || c == '?' || c == '#') return url.substring(0, i);
        }
        return null;
    }

    /** 이 패턴을 통과(유지)하는지: 일반 패턴은 일치해야, 제외 패턴은 불일치해야 통과 */
    public boolean accepts(String url) {
        boolean m = matchesBody(url);
        return negated ? !m : m;
    }

    public boolean isNegated() { return negated; }

    public String source() { return source; }

    static String globToRegex(String glob) {
        StringBuilder r = new StringBuilder(glob.length() + 8);
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            switch (c) {
                case '*': r.append(".*"); break;
                case '.': case '\\': case '+': case '(': case ')': case '?':
                case '^': case '$': case '|': case '{': case '}':
                case '[': case ']': r.append('\\').append(c); break;
                default: r.append(c);
            }
        }
        return r.toString();
    }
}
