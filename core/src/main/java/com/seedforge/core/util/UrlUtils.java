package com.seedforge.core.util;

import java.net.URI;
import java.util.Locale;

/** 호스트/도메인 추출 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * URL에서 호스트를 소문자로 뽑는다. 포트/userinfo 제외.
     * java.net.URI가 거부하는 문자(공백, 밑줄 호스트 등)가 있으면 authority를 직접 자른다.
     * 호스트가 없으면 null.
     */
    public static String hostOf(String url) {
        if (url == null || url.isBlank()) return null;
        try {
            URI u = URI.create(url.trim());
            if (u.getHost() != null && !u.getHost().isEmpty()) {
                return stripBrackets(u.getHost()).toLowerCase(Locale.ROOT);
            }
        } catch (IllegalArgumentException ignore) {
            // 아래의 느슨한 파싱으로 넘어간다
        }
        return lenientHost(url.trim());
    }

    private static String lenientHost(String s) {
        int sep = s.indexOf("://");
        if (sep <= 0) return null;
        int start = sep + 3;
        int end = s.length();
        for (int i = start; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '/' || c == '?' || c == '#') { end = i; break; }
        }
        String authority = s.substring(start, end);
        int at = authority.lastIndexOf('@');
        if (at >= 0) authority = authority.substring(at + 1);

        String host;
        if (authority.startsWith("[")) {
            int close = authority.indexOf(']');
            if (close < 0) return null;
            host = authority.substring(1, close);
        } else {
            int colon = authority.indexOf(':');
            host = colon >= 0 ? authority.substring(0, colon) : authority;
        }
        host = host.trim();
        return host.isEmpty() ? null : host.toLowerCase(Locale.ROOT);
    }

    private static String stripBrackets(String h) {
        return (h.startsWith("[") && h.endsWith("]")) ? h.substring(1, h.length() - 1) : h;
    }

    /** 마지막 두 라벨(예: www.epa.gov → epa.gov). 공용 접미사 목록은 쓰지 않는 근사치 */
    public static String registrableDomain(String host) {
        if (host == null) return null;
        String[] labels = host.split("\\.");
        if (labels.length <= 2) return host;
        return labels[labels.length - 2] + "." + labels[labels.length - 1];
    }

    /** fragment 표시(#) 포함 여부: SPA 단일 페이지 시드 판단용 */
    public static boolean hasFragment(String url) {
        return url != null && url.indexOf('#') >= 0;
    }
}
