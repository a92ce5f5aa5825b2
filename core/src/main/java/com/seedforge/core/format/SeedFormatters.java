package com.seedforge.core.format;

import com.seedforge.core.api.ISeedFormatter;
import com.seedforge.core.model.OutputFormat;

/** OutputFormat → 포맷터 */
public final class SeedFormatters {
    private SeedFormatters() {}

    public static ISeedFormatter forFormat(OutputFormat format) {
        return switch (format) {
            case TEXT -> new TextSeedFormatter();
            case BROWSERTRIX -> new BrowsertrixSeedFormatter();
        };
    }
}
