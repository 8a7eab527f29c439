package com.govinsights.payrollcatalog.application.ingest.dto;

import com.govinsights.payrollcatalog.application.load.FailedBatch;

import java.util.List;
import java.util.Map;

/**
 * 회계연도 하나의 ingest 결과 응답 DTO.
 *
 * @param fiscalYear       회계연도
 * @param status           처리 상태
 * @param rosterRows       roster 시트에서 읽은 행 수
 * @param detailRows       detail 시트에서 읽은 행 수
 * @param combinedRows     조인 후 적재 대상 row 수
 * @param skippedRows      식별자가 없어 제외된 roster 행 수
 * @param matchedRows      detail과 일치한 row 수
 * @param detailDuplicates detail 시트의 중복 식별자 수
 * @param fieldAnomalies   필드별 해석 불가 셀 수
 * @param inserted         새로 저장(또는 갱신)된 row 수
 * @param alreadyPresent   자연키가 이미 있어 건너뛴 row 수
 * @param failed           실패 배치에 속한 row 수
 * @param batches          시도한 배치 수
 * @param failedBatches    실패 배치 목록
 * @param message          상태 메시지(Nullable)
 */
public record IngestSummary(
        int fiscalYear,
        Status status,
        int rosterRows,
        int detailRows,
        int combinedRows,
        int skippedRows,
        int matchedRows,
        int detailDuplicates,
        Map<String, Integer> fieldAnomalies,
        long inserted,
        long alreadyPresent,
        long failed,
        int batches,
        List<FailedBatch> failedBatches,
        String message
) {
    public enum Status { COMPLETED, STRUCTURE_ERROR }

    /**
     * 구조 오류로 처리하지 못한 회계연도 결과를 만든다.
     *
     * @param fiscalYear 회계연도
     * @param message    오류 메시지
     * @return 카운트가 모두 0인 결과
     */
    public static IngestSummary structureError(int fiscalYear, String message) {
        return new IngestSummary(fiscalYear, Status.STRUCTURE_ERROR, 0, 0, 0, 0, 0, 0,
                Map.of(), 0, 0, 0, 0, List.of(), message);
    }

    public int anomalies() {
        return fieldAnomalies.values().stream().mapToInt(Integer::intValue).sum();
    }
}
