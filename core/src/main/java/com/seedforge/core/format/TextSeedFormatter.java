package com.seedforge.core.format;

import com.seedforge.core.api.ISeedFormatter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** 정렬된 URL을 한 줄에 하나씩. 옵션은 쓰지 않는다. */
public final class TextSeedFormatter implements ISeedFormatter {
    @Override
    public String format(Iterable<String> urls, FormatOptions options) {
        List<String> sorted = new ArrayList<>();
        for (String u : urls) sorted.add(u);
        Collections.sort(sorted);
        StringBuilder sb = new StringBuilder(sorted.size() * 48);
        for (String u : sorted) sb.append(u).append('\n');
        return sb.toString();
    }
}
