package com.seedforge.core.seeds;

import com.seedforge.core.error.InvalidConfigurationException;
import com.seedforge.core.model.Batch;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * 그룹을 크기 상한이 있는 배치로 나눈다. 2단계 정책:
 * <ol>
 *   <li>대형 그룹(size >= targetSize): 순서대로 oversizedSplitSize씩 잘라 "&lt;key&gt;-n" 배치(workers=1)</li>
 *   <li>나머지: 그룹을 쪼개지 않고 first-fit 탐욕 패킹 → "other-n" 배치(workers=사용자 값)</li>
 * </ol>
 * 같은 입력(내용+순서)이면 결과도 항상 같다. 입력 맵은 건드리지 않는다.
 */
public final class SeedPacker {
    private static final Logger LOG = Logger.getLogger(SeedPacker.class.getName());

    public static final String OTHER_PREFIX = "other-";
    /** 단일 도메인 청크는 이미 격리돼 있으므로 워커 1 */
    public static final int OVERSIZED_WORKERS = 1;

    private SeedPacker() {}

    /**
     * @param oversizedSplitSize 0이면 targetSize 사용, 음수는 설정 오류
     */
    public static List<Batch> pack(Map<String, List<String>> groups,
                                   int targetSize,
                                   int oversizedSplitSize,
                                   int workers) {
        Objects.requireNonNull(groups, "groups");
        if (targetSize <= 0) {
            throw new InvalidConfigurationException("target size must be > 0 (got " + targetSize + ")");
        }
        if (oversizedSplitSize < 0) {
            throw new InvalidConfigurationException("oversized split size must be >= 0 (got " + oversizedSplitSize + ")");
        }
        int splitSize = oversizedSplitSize > 0 ? oversizedSplitSize : targetSize;
        if (workers < 1) {
            throw new InvalidConfigurationException("workers must be >= 1 (got " + workers + ")");
        }

        List<Batch> out = new ArrayList<>();
        LinkedHashMap<String, List<String>> remaining = new LinkedHashMap<>(groups);

        // 1) 대형 그룹 분리. ">=" 라서 target == split 이어도 항상 진행한다
        Iterator<Map.Entry<String, List<String>>> it = remaining.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, List<String>> e = it.next();
            List<String> urls = e.getValue();
            if (urls.size() < targetSize) continue;
            it.remove();
            out.addAll(split(e.getKey(), urls, splitSize));
        }

        // 2) 나머지 그룹 first-fit
        int index = 0;
        while (!remaining.isEmpty()) {
            List<String> subset = new ArrayList<>();
            int capacity = targetSize;
            Iterator<Map.Entry<String, List<String>>> scan = remaining.entrySet().iterator();
            while (scan.hasNext()) {
                List<String> urls = scan.next().getValue();
                if (urls.size() > capacity) continue;
                scan.remove();
                subset.addAll(urls);
                capacity -= urls.size();
                if (capacity == 0) break;
            }
            index++;
            out.add(new Batch(OTHER_PREFIX + index, subset, workers));
        }

        LOG.fine(() -> "Packed " + groups.size() + " groups into " + out.size() + " batches");
        return out;
    }

    /** 한 그룹을 splitSize 단위 연속 청크로. 이름은 1부터 */
    static List<Batch> split(String key, List<String> urls, int splitSize) {
        List<Batch> chunks = new ArrayList<>();
        for (int from = 0, n = 1; from < urls.size(); from += splitSize, n++) {
            int to = Math.min(urls.size(), from + splitSize);
            chunks.add(new Batch(key + "-" + n, urls.subList(from, to), OVERSIZED_WORKERS));
        }
        return chunks;
    }
}
