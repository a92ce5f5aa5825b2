package com.seedforge.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Map;

/** 외부 추적 시스템으로 넘기는 네트워크 오류 레코드 */
@JsonPropertyOrder({"url", "capture_time", "network_error", "source_type", "source_metadata"})
public record ImportRecord(
        @JsonProperty("url") String url,
        @JsonProperty("capture_time") Instant captureTime,
        @JsonProperty("network_error") String networkError,
        @JsonProperty("source_type") String sourceType,
        @JsonProperty("source_metadata") Map<String, Object> sourceMetadata) {
}
