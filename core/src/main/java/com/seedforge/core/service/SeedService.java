package com.seedforge.core.service;

import com.seedforge.core.api.ISeedFormatter;
import com.seedforge.core.api.IUrlCatalog;
import com.seedforge.core.format.FormatOptions;
import com.seedforge.core.format.SeedFormatters;
import com.seedforge.core.model.Batch;
import com.seedforge.core.model.GroupBy;
import com.seedforge.core.model.OutputFormat;
import com.seedforge.core.model.PrecheckResult;
import com.seedforge.core.model.SeedConfig;
import com.seedforge.core.precheck.PrecheckLogIO;
import com.seedforge.core.precheck.Prechecker;
import com.seedforge.core.seeds.SeedPacker;
import com.seedforge.core.seeds.UrlGrouper;
import com.seedforge.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * 시드 생성 오케스트레이터:
 *  - catalog → (precheck) → 포맷 (단일 시드 문서)
 *  - catalog → (precheck + 로그 기록) → 도메인 그룹 → 패킹 → 배치별 포맷/파일 쓰기
 */
public final class SeedService {

    private static final Logger LOG = LoggerFactory.getLogger(SeedService.class);
    private static final StructuredLog SLOG = StructuredLog.get(SeedService.class);

    private final SeedConfig config;
    private final IUrlCatalog catalog;
    private final Prechecker prechecker;
    private final PrecheckLogIO logIO = new PrecheckLogIO();

    public SeedService(SeedConfig config, IUrlCatalog catalog) {
        this(config, catalog, new Prechecker(config.precheck()));
    }

    /** DI/테스트용 */
    public SeedService(SeedConfig config, IUrlCatalog catalog, Prechecker prechecker) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.prechecker = Objects.requireNonNull(prechecker, "prechecker");
    }

    /** 시드 문서 하나를 만들어 돌려준다. 프리체크 로그는 남기지 않는다. */
    public String generateSeeds(OutputFormat format, String pattern, int workers, boolean precheck) throws IOException {
        Objects.requireNonNull(format, "format");
        LOG.info("Generating seeds as {}...", format.cliName());

        Iterable<String> urls = catalog.getActiveUrls(pattern);
        if (precheck) {
            urls = prechecker.precheck(urls).reachable();
        }
        FormatOptions opts = FormatOptions.from(config.browsertrix(), workers);
        return SeedFormatters.forFormat(format).format(urls, opts);
    }

    /**
     * 크기 상한이 있는 시드 파일 여러 개를 outputDir에 쓴다.
     * 크기/분할/워커 수는 config.packing()을 따른다.
     * @return 쓴 파일의 기본 이름 목록(".seeds.&lt;ext&gt;" 제외), 쓴 순서대로
     */
    public List<String> generateMultiSeeds(OutputFormat format, String pattern, boolean precheck) throws IOException {
        Objects.requireNonNull(format, "format");
        SeedConfig.PackingCfg packing = config.packing();
        Path output = config.getOutputDir();

        LOG.info("Writing seed files to \"{}/*\"...", output);
        Files.createDirectories(output);

        Iterable<String> urls = catalog.getActiveUrls(pattern);
        if (precheck) {
            PrecheckResult result = prechecker.precheck(urls);
            Path logPath = logIO.write(output, result.log());
            LOG.info("Wrote precheck log \"{}\"", logPath);
            urls = result.reachable();
        }

        LinkedHashMap<String, List<String>> groups = UrlGrouper.group(urls, GroupBy.DOMAIN);
        List<Batch> batches = SeedPacker.pack(groups, packing.getSize(),
                packing.getSingleGroupSize(), packing.getWorkers());

        ISeedFormatter formatter = SeedFormatters.forFormat(format);
        FormatOptions base = FormatOptions.from(config.browsertrix(), packing.getWorkers());

        List<String> names = new ArrayList<>(batches.size());
        for (Batch batch : batches) {
            Path file = SeedFileNaming.seedPath(output, batch.getName(), format);
            String doc = formatter.format(batch.getUrls(), base.withWorkers(batch.getWorkers()));
            Files.writeString(file, doc, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            names.add(SeedFileNaming.baseName(file.getFileName().toString()));

            LOG.info("Wrote \"{}\"", file);
            SLOG.info("batch-written",
                    "name", batch.getName(),
                    "file", file.getFileName().toString(),
                    "urls", batch.size(),
                    "workers", batch.getWorkers());
        }

        SLOG.info("multi-seeds-done", "groups", groups.size(), "files", names.size());
        return names;
    }

    public Prechecker getPrechecker() {
        return prechecker;
    }
}
