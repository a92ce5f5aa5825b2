package com.seedforge.core.model;

import java.util.Locale;

/** 시드 출력 형식. extension은 파일명 "<name>.seeds.<ext>"에 쓰인다. */
public enum OutputFormat {
    TEXT("txt"),
    BROWSERTRIX("yaml");

    private final String extension;

    OutputFormat(String extension) { this.extension = extension; }

    public String extension() { return extension; }

    /** CLI 문자열("text" | "browsertrix") 해석. 모르는 값이면 IllegalArgumentException */
    public static OutputFormat parse(String s) {
        if (s != null) {
            String n = s.trim().toUpperCase(Locale.ROOT);
            for (OutputFormat f : values()) {
                if (f.name().equals(n)) return f;
            }
        }
        throw new IllegalArgumentException("Unknown format: \"" + s + "\"");
    }

    public String cliName() { return name().toLowerCase(Locale.ROOT); }
}
