package com.govinsights.payrollcatalog.application.load;

/**
 * upsert와 fallback insert가 모두 실패한 배치.
 *
 * @param index   배치 순번(0부터)
 * @param fromRow 첫 row 위치(포함, 0부터)
 * @param toRow   마지막 row 위치(제외)
 * @param message 마지막 오류 메시지
 */
public record FailedBatch(int index, int fromRow, int toRow, String message) {

    public int size() {
        return toRow - fromRow;
    }
}
