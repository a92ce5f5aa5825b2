package com.seedforge.core.error;

/** 시드 생성 파이프라인의 복구 불가 오류 공통 부모. 런을 중단시킨다. */
public class SeedForgeException extends RuntimeException {
    public SeedForgeException(String message) { super(message); }
    public SeedForgeException(String message, Throwable cause) { super(message, cause); }
}
