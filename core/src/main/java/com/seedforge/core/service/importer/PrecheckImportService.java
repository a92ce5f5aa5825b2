package com.seedforge.core.service.importer;

import com.seedforge.core.api.IJobImporter;
import com.seedforge.core.model.ImportRecord;
import com.seedforge.core.model.PrecheckEntry;
import com.seedforge.core.precheck.PrecheckLogIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * precheck.log.json의 도달 불가 호스트를 네트워크 오류 레코드로 바꿔 외부 시스템에 넘긴다.
 * 잡별 오류 건수는 경고로 보고만 하고 실패로 처리하지 않는다.
 */
public final class PrecheckImportService {
    private static final Logger LOG = Logger.getLogger(PrecheckImportService.class.getName());

    public static final String SOURCE_TYPE = "edgi_crawler_precheck";

    private final IJobImporter importer;
    private final PrecheckLogIO logIO;

    public PrecheckImportService(IJobImporter importer) {
        this(importer, new PrecheckLogIO());
    }

    public PrecheckImportService(IJobImporter importer, PrecheckLogIO logIO) {
        this.importer = Objects.requireNonNull(importer, "importer");
        this.logIO = Objects.requireNonNull(logIO, "logIO");
    }

    /** 오류가 있는 호스트의 URL마다 레코드 하나. 로그 순서 유지 */
    public static List<ImportRecord> buildRecords(Map<String, PrecheckEntry> log) {
        List<ImportRecord> out = new ArrayList<>();
        for (Map.Entry<String, PrecheckEntry> e : log.entrySet()) {
            PrecheckEntry entry = e.getValue();
            if (entry == null || !entry.isUnreachable()) continue;
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("precheck_host", e.getKey());
            for (String url : entry.urls) {
                out.add(new ImportRecord(url, entry.timestamp, entry.error, SOURCE_TYPE, meta));
            }
        }
        return out;
    }

    public ImportSummary importLog(Path logFile) throws IOException {
        Map<String, PrecheckEntry> log = logIO.read(logFile);
        List<ImportRecord> records = buildRecords(log);
        LOG.info(() -> "Importing " + records.size() + " network-error records from " + logFile);

        Map<String, Integer> errors = records.isEmpty() ? Map.of() : importer.importRecords(records);
        ImportSummary summary = new ImportSummary(records.size(), errors == null ? Map.of() : errors);

        for (Map.Entry<String, Integer> e : summary.errorsByJob().entrySet()) {
            if (e.getValue() != null && e.getValue() > 0) {
                LOG.warning("Import job " + e.getKey() + " reported " + e.getValue() + " errors");
            }
        }
        return summary;
    }
}
