package com.govinsights.payrollcatalog.application.audit.dto;

import com.govinsights.payrollcatalog.application.audit.AuditReport;

import java.util.List;
import java.util.Map;

/**
 * 회계연도 워크북 진단 결과 응답 DTO.
 *
 * @param fiscalYear     회계연도
 * @param handle         워크북 파일명
 * @param sheetNames     전체 시트 이름
 * @param roster         roster 시트 요약
 * @param detail         detail 시트 요약
 * @param activeColumn   재직 여부 컬럼 라벨(Nullable)
 * @param fieldAnomalies 필드별 해석 불가 셀 수
 * @param report         조인 결과에 대한 품질 점검 결과
 */
public record DatasetAssessment(
        int fiscalYear,
        String handle,
        List<String> sheetNames,
        SheetSummary roster,
        SheetSummary detail,
        String activeColumn,
        Map<String, Integer> fieldAnomalies,
        AuditReport report
) {

    /**
     * 시트 하나의 요약.
     *
     * @param name    시트 이름
     * @param columns 헤더 컬럼 수
     * @param rows    데이터 행 수
     */
    public record SheetSummary(String name, int columns, int rows) {}
}
