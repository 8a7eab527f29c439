package com.govinsights.payrollcatalog.application.load;

import java.util.ArrayList;
import java.util.List;

/**
 * 적재 결과 집계.
 *
 * @param succeeded        성공한 배치에 속한 row 수
 * @param failed           실패한 배치에 속한 row 수
 * @param reported         저장소가 보고한 변경 row 수 합계(SKIP 정책에서는 신규 insert 수)
 * @param batchesAttempted 시도한 배치 수
 * @param failedBatches    실패 배치 목록(순서 유지)
 */
public record LoadResult(
        long succeeded,
        long failed,
        long reported,
        int batchesAttempted,
        List<FailedBatch> failedBatches
) {
    public LoadResult {
        failedBatches = List.copyOf(failedBatches);
    }

    public static LoadResult empty() {
        return new LoadResult(0, 0, 0, 0, List.of());
    }

    static LoadResult ofSuccess(int rows, long reported) {
        return new LoadResult(rows, 0, reported, 1, List.of());
    }

    static LoadResult ofFailure(FailedBatch batch) {
        return new LoadResult(0, batch.size(), 0, 1, List.of(batch));
    }

    /** 두 결과를 합칩니다(실패 배치 순서 유지). */
    public LoadResult plus(LoadResult other) {
        List<FailedBatch> merged = new ArrayList<>(failedBatches);
        merged.addAll(other.failedBatches);
        return new LoadResult(
                succeeded + other.succeeded,
                failed + other.failed,
                reported + other.reported,
                batchesAttempted + other.batchesAttempted,
                merged
        );
    }
}
