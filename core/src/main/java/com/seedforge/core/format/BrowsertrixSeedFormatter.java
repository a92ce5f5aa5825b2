package com.seedforge.core.format;

import com.seedforge.core.api.ISeedFormatter;
import com.seedforge.core.model.GroupBy;
import com.seedforge.core.seeds.Interleaver;
import com.seedforge.core.seeds.UrlGrouper;
import com.seedforge.core.util.UrlUtils;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Browsertrix 크롤 설정 YAML.
 * 시드 순서:
 *  - arcgis 그룹을 맨 앞에 몰아서(브라우저 메모리 압박이 커 한데 모아 처리)
 *  - 나머지 도메인은 인터리브 → 도메인마다 요청 속도를 낮게 유지해 차단 위험을 줄임
 * '#'가 있는 URL은 SPA 페이지로 보고 {url, scopeType: page-spa, depth: 0} 으로 쓴다.
 */
public final class BrowsertrixSeedFormatter implements ISeedFormatter {

    private final Yaml yaml;

    public BrowsertrixSeedFormatter() {
        DumperOptions opts = new DumperOptions();
        opts.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        opts.setIndent(2);
        opts.setWidth(4096);
        this.yaml = new Yaml(opts);
    }

    @Override
    public String format(Iterable<String> urls, FormatOptions options) {
        FormatOptions o = (options != null ? options : FormatOptions.defaults());

        List<Object> seeds = new ArrayList<>();
        for (String url : crawlOrder(urls)) {
            if (UrlUtils.hasFragment(url)) {
                Map<String, Object> spa = new LinkedHashMap<>();
                spa.put("url", url);
                spa.put("scopeType", "page-spa");
                spa.put("depth", 0);
                seeds.add(spa);
            } else {
                seeds.add(url);
            }
        }

        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("workers", o.getWorkers());
        doc.put("saveStateHistory", o.getSaveStateHistory());
        doc.put("scopeType", "page");
        doc.put("rolloverSize", o.getRolloverSize());
        // 기본 90초로는 CloudFront 타임아웃이 긴 사이트가 끊긴다
        doc.put("pageLoadTimeout", o.getPageLoadTimeout());
        doc.putAll(o.getOverrides());

        Map<String, Object> warcinfo = new LinkedHashMap<>();
        warcinfo.put("operator", o.getOperator());
        Object extra = o.getOverrides().get("warcinfo");
        if (extra instanceof Map<?, ?> m) {
            for (Map.Entry<?, ?> e : m.entrySet()) warcinfo.put(String.valueOf(e.getKey()), e.getValue());
        }
        doc.put("warcinfo", warcinfo);
        doc.remove("seeds");
        doc.put("seeds", seeds);

        return yaml.dump(doc);
    }

    /** arcgis 먼저, 나머지 도메인 그룹은 라운드로빈 */
    public static List<String> crawlOrder(Iterable<String> urls) {
        LinkedHashMap<String, List<String>> groups = UrlGrouper.group(urls, GroupBy.DOMAIN);
        List<String> arcgis = groups.remove(UrlGrouper.ARCGIS_KEY);

        List<String> out = new ArrayList<>();
        if (arcgis != null) out.addAll(arcgis);
        for (String u : Interleaver.interleave(new ArrayList<>(groups.values()))) out.add(u);
        return out;
    }
}
