package com.govinsights.payrollcatalog.application.ingest;

import com.govinsights.payrollcatalog.infrastructure.mapper.RecordExtractor.ExtractionResult;

import java.util.List;

/**
 * 회계연도 워크북 하나를 읽고 정규화한 결과.
 *
 * @param fiscalYear    회계연도
 * @param handle        워크북 파일명
 * @param sheetNames    워크북의 전체 시트 이름
 * @param rosterSheet   roster(HR INFO) 시트 이름
 * @param detailSheet   detail(EARNINGS) 시트 이름
 * @param rosterHeader  roster 헤더
 * @param detailHeader  detail 헤더
 * @param activeColumn  재직 여부 컬럼 라벨(Nullable)
 * @param roster        roster 추출 결과
 * @param detail        detail 추출 결과
 */
public record PayrollDataset(
        int fiscalYear,
        String handle,
        List<String> sheetNames,
        String rosterSheet,
        String detailSheet,
        List<String> rosterHeader,
        List<String> detailHeader,
        String activeColumn,
        ExtractionResult roster,
        ExtractionResult detail
) {}
