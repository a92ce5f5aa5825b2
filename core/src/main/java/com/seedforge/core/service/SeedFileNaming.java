package com.seedforge.core.service;

import com.seedforge.core.model.OutputFormat;

import java.nio.file.Path;

/** 시드 파일 이름 규칙: "&lt;group-name&gt;.seeds.&lt;ext&gt;", 그룹 이름의 '.'은 '-'로 */
public final class SeedFileNaming {
    public static final String SEEDS_MARKER = ".seeds";

    private SeedFileNaming() {}

    public static String safeName(String batchName) {
        return batchName.replace('.', '-');
    }

    public static String fileName(String batchName, OutputFormat format) {
        return safeName(batchName) + SEEDS_MARKER + "." + format.extension();
    }

    public static Path seedPath(Path dir, String batchName, OutputFormat format) {
        return dir.resolve(fileName(batchName, format));
    }

    /** "epa-gov-1.seeds.yaml" → "epa-gov-1" (크롤 매트릭스 입력용) */
    public static String baseName(String fileName) {
        int i = fileName.indexOf(SEEDS_MARKER);
        return i >= 0 ? fileName.substring(0, i) : fileName;
    }
}
