package com.seedforge.core.util;

import com.seedforge.core.model.SeedConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * seeds.yml을 읽어 SeedConfig로 변환.
 *
 * 예상 YAML 키:
 * precheck:
 *   concurrency: 5
 *   connectTimeoutMs: 60000
 *   readTimeoutMs: 10000
 *   retries: 2
 *   backoffMs: 500
 *   userAgent: "..."
 *   exemptions: ["host:example.gov", "url:https://x.gov/y", "domain:arcgis.com"]
 * packing:
 *   size: 1000
 *   singleGroupSize: 0
 *   workers: 2
 * browsertrix:
 *   operator: '"Org" <mail@example.org>'
 *   pageLoadTimeout: 120
 *   rolloverSize: 8000000000
 *   options: { ... }      # 크롤 설정 문서에 그대로 덮어쓴다
 * catalog:
 *   ignoreUrls: [ ... ]
 * output:
 *   dir: "seeds"
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static SeedConfig loadDefault() throws IOException {
        return load(Path.of("seeds.yml"));
    }

    public static SeedConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("seeds.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root = yaml.load(in);

            SeedConfig cfg = SeedConfig.defaults();

            if (!(root instanceof Map<?, ?> map)) {
                // 비어있거나 단순 스칼라면 defaults 유지
                cfg.validate();
                return cfg;
            }

            // 1) precheck.*
            Map<String, Object> pre = getMap(map, "precheck");
            if (pre != null) {
                var p = cfg.precheck();
                setInt(pre, "concurrency", p::setConcurrency);
                setDurationMs(pre, "connectTimeoutMs", p::setConnectTimeout);
                setDurationMs(pre, "readTimeoutMs", p::setReadTimeout);
                setInt(pre, "retries", p::setRetries);
                setLong(pre, "backoffMs", p::setBackoffMs);
                setString(pre, "userAgent", p::setUserAgent);
                setStringList(pre, "exemptions", p::setExemptions);
            }

            // 2) packing.*
            Map<String, Object> pack = getMap(map, "packing");
            if (pack != null) {
                var k = cfg.packing();
                setInt(pack, "size", k::setSize);
                setInt(pack, "singleGroupSize", k::setSingleGroupSize);
                setInt(pack, "workers", k::setWorkers);
            }

            // 3) browsertrix.*
            Map<String, Object> bt = getMap(map, "browsertrix");
            if (bt != null) {
                var b = cfg.browsertrix();
                setString(bt, "operator", b::setOperator);
                setInt(bt, "pageLoadTimeout", b::setPageLoadTimeout);
                setLong(bt, "rolloverSize", b::setRolloverSize);
                Map<String, Object> opts = getMap(bt, "options");
                if (opts != null) b.setOptions(opts);
            }

            // 4) catalog.ignoreUrls
            Map<String, Object> catalog = getMap(map, "catalog");
            if (catalog != null) {
                setStringList(catalog, "ignoreUrls", cfg::setIgnoreUrls);
            }

            // 5) output.dir
            Map<String, Object> output = getMap(map, "output");
            if (output != null) {
                setPath(output, "dir", cfg::setOutputDir);
            }

            cfg.validate();
            return cfg;
        }
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof List<?> list) {
            List<String> out = new ArrayList<>();
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
            setter.accept(List.copyOf(out));
            return;
        }
        // "a,b,c" 형태 지원
        String s = String.valueOf(v).trim();
        if (!s.isEmpty()) {
            List<String> out = new ArrayList<>();
            for (String p : s.split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
            setter.accept(List.copyOf(out));
        }
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim().replace("_", "")));
    }

    private static void setDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }
}
