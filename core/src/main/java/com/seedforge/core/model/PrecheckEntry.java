package com.seedforge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** precheck.log.json 의 호스트별 항목: {timestamp, error, urls} */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"timestamp", "error", "urls"})
public class PrecheckEntry {
    public Instant timestamp;
    /** 도달 가능이면 null */
    public String error;
    /** 도달 불가 호스트일 때만 채워진다 */
    public List<String> urls = new ArrayList<>();

    public PrecheckEntry() {}

    public PrecheckEntry(Instant timestamp, Verdict verdict, List<String> urls) {
        this.timestamp = timestamp;
        this.error = verdict.wireName();
        this.urls = verdict.isUnreachable() ? List.copyOf(urls) : List.of();
    }

    @JsonIgnore
    public Verdict verdict() { return Verdict.fromWireName(error); }

    @JsonIgnore
    public boolean isUnreachable() { return error != null; }
}
