package com.seedforge.core.error;

/** 호스트를 뽑을 수 없는 URL. 데이터 무결성 오류이므로 조용히 버리지 않는다. */
public class InvalidHostnameException extends SeedForgeException {
    private final String url;

    public InvalidHostnameException(String url) {
        super("No hostname: \"" + url + "\"");
        this.url = url;
    }

    public String getUrl() { return url; }
}
