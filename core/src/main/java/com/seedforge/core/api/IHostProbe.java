package com.seedforge.core.api;

import com.seedforge.core.model.Verdict;

/**
 * 호스트 도달성 프로브 최소 계약: 대표 URL 하나를 받아 판정을 돌려준다.
 * 구현체는 스레드 하나에 묶여 쓰인다(워커별 인스턴스). 던진 예외는 호출자가 분류한다.
 */
@FunctionalInterface
public interface IHostProbe {
    Verdict probe(String url) throws Exception;
}
