package com.seedforge.core.precheck;

import com.seedforge.core.util.UrlUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * 프리체크를 건너뛸 대상 목록(운영 데이터). 자주 바뀌므로 파일/설정에서 읽는다.
 * 항목 형식: "url:https://x.gov/a", "host:www.x.gov", "domain:x.gov". 접두어가 없으면 host.
 * 파일은 한 줄에 하나, '#' 이후는 주석.
 */
public final class PrecheckExemptions {

    public enum Scope { URL, HOST, DOMAIN }

    public record Rule(Scope scope, String value) {}

    public static final PrecheckExemptions NONE = new PrecheckExemptions(List.of());

    private final List<Rule> rules;

    private PrecheckExemptions(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static PrecheckExemptions parse(Collection<String> entries) {
        if (entries == null || entries.isEmpty()) return NONE;
        List<Rule> out = new ArrayList<>();
        for (String raw : entries) {
            Rule r = parseRule(raw);
            if (r != null) out.add(r);
        }
        return new PrecheckExemptions(out);
    }

    public static PrecheckExemptions load(Path file) throws IOException {
        return parse(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    static Rule parseRule(String raw) {
        if (raw == null) return null;
        String s = raw;
        int hash = s.indexOf('#');
        // url: 항목은 fragment(#)가 값의 일부일 수 있으므로 줄 맨 앞 주석만 처리
        if (hash == 0) return null;
        if (hash > 0 && !s.trim().toLowerCase(Locale.ROOT).startsWith("url:")) s = s.substring(0, hash);
        s = s.trim();
        if (s.isEmpty()) return null;

        int colon = s.indexOf(':');
        if (colon > 0) {
            String prefix = s.substring(0, colon).toLowerCase(Locale.ROOT);
            String value = s.substring(colon + 1).trim();
            switch (prefix) {
                case "url":    return new Rule(Scope.URL, value);
                case "host":   return new Rule(Scope.HOST, value.toLowerCase(Locale.ROOT));
                case "domain": return new Rule(Scope.DOMAIN, value.toLowerCase(Locale.ROOT));
                default: break;
            }
        }
        return new Rule(Scope.HOST, s.toLowerCase(Locale.ROOT));
    }

    public PrecheckExemptions merge(PrecheckExemptions other) {
        if (other == null || other.rules.isEmpty()) return this;
        List<Rule> all = new ArrayList<>(rules);
        all.addAll(other.rules);
        return new PrecheckExemptions(all);
    }

    /** host가 면제 대상인지. url 범위 규칙은 대표 URL(representative)로만 비교 */
    public boolean isExempt(String host, String representative) {
        if (rules.isEmpty() || host == null) return false;
        for (Rule r : rules) {
            switch (r.scope()) {
                case URL:
                    if (r.value().equals(representative)) return true;
                    break;
                case HOST:
                    if (r.value().equals(host)) return true;
                    break;
                case DOMAIN:
                    if (host.equals(r.value()) || host.endsWith("." + r.value())) return true;
                    break;
                default:
                    break;
            }
        }
        return false;
    }

    /** 대표 URL에서 호스트를 직접 뽑아 판정 */
    public boolean isExempt(String representative) {
        return isExempt(UrlUtils.hostOf(representative), representative);
    }

    public List<Rule> rules() { return rules; }

    public boolean isEmpty() { return rules.isEmpty(); }
}
