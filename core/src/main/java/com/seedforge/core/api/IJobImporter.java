package com.seedforge.core.api;

import com.seedforge.core.model.ImportRecord;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/** 외부 추적 시스템으로 레코드를 넘기고 잡별 오류 건수를 받는다. */
public interface IJobImporter {
    Map<String, Integer> importRecords(List<ImportRecord> records) throws IOException;
}
