package com.seedforge.core.catalog;

import com.seedforge.core.api.IUrlCatalog;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 원천 목록 위에 패턴/무시 목록을 적용하는 카탈로그.
 * - "!pat": 원천은 필터 없이 조회하고 결과에서 pat과 완전히 일치하는 URL을 뺀다
 * - "pat":  원천에 그대로 넘긴다(원천이 필터링)
 * - ignoreUrls: 알려진 죽은 서버, 404 고정 URL 등 정확히 일치하는 URL 제외
 */
public final class FilteringUrlCatalog implements IUrlCatalog {
    private static final Logger LOG = Logger.getLogger(FilteringUrlCatalog.class.getName());

    private final UrlSource source;
    private final Set<String> ignoreUrls;

    public FilteringUrlCatalog(UrlSource source) {
        this(source, List.of());
    }

    public FilteringUrlCatalog(UrlSource source, Collection<String> ignoreUrls) {
        this.source = Objects.requireNonNull(source, "source");
        this.ignoreUrls = new LinkedHashSet<>(ignoreUrls == null ? List.of() : ignoreUrls);
    }

    @Override
    public List<String> getActiveUrls(String pattern) throws IOException {
        WildcardPattern p = WildcardPattern.parse(pattern);
        WildcardPattern antipattern = (p != null && p.isNegated()) ? p : null;
        String sourcePattern = (p != null && !p.isNegated()) ? pattern : null;

        List<String> out = new ArrayList<>();
        int ignored = 0;
        for (String url : source.fetch(sourcePattern)) {
            if (ignoreUrls.contains(url)) { ignored++; continue; }
            if (antipattern != null && antipattern.matchesBody(url)) continue;
            out.add(url);
        }
        final int ign = ignored;
        LOG.fine(() -> "Catalog returned " + out.size() + " URLs (ignored=" + ign + ", pattern=" + pattern + ")");
        return out;
    }
}
