package com.seedforge.core.model;

/** URL 그룹 키 선택: 정확한 호스트 또는 등록 도메인(arcgis 예외 포함) */
public enum GroupBy { HOST, DOMAIN }
