package com.seedforge.core.seeds;

import com.seedforge.core.error.InvalidHostnameException;
import com.seedforge.core.model.GroupBy;
import com.seedforge.core.util.UrlUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * URL을 호스트 또는 등록 도메인 기준으로 묶는다.
 * - 그룹 순서 = 키 최초 등장 순, 그룹 내부 순서 = 입력 순
 * - arcgis가 들어간 호스트는 도메인 모드에서 전부 "arcgis" 한 그룹으로 모은다
 *   (ArcGIS 뷰어는 브라우저 메모리 부담이 커서 따로 모아 크롤해야 함)
 */
public final class UrlGrouper {
    public static final String ARCGIS_KEY = "arcgis";

    private UrlGrouper() {}

    public static LinkedHashMap<String, List<String>> group(Iterable<String> urls, GroupBy by) {
        Objects.requireNonNull(urls, "urls");
        Objects.requireNonNull(by, "by");
        LinkedHashMap<String, List<String>> groups = new LinkedHashMap<>();
        for (String url : urls) {
            groups.computeIfAbsent(keyOf(url, by), k -> new ArrayList<>()).add(url);
        }
        return groups;
    }

    /** 단일 URL의 그룹 키. 호스트가 없으면 InvalidHostnameException */
    public static String keyOf(String url, GroupBy by) {
        String host = UrlUtils.hostOf(url);
        if (host == null) throw new InvalidHostnameException(url);
        return switch (by) {
            case HOST -> host;
            case DOMAIN -> host.contains(ARCGIS_KEY) ? ARCGIS_KEY : UrlUtils.registrableDomain(host);
        };
    }
}
