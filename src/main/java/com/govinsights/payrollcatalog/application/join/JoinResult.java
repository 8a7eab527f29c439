package com.govinsights.payrollcatalog.application.join;

import com.govinsights.payrollcatalog.infrastructure.mapper.NormalizedRecord;

import java.util.List;

/**
 * roster × detail 조인 결과.
 *
 * @param combined         roster 순서를 유지한 조인 레코드
 * @param droppedRoster    식별자가 비어 있어 제외된 roster 레코드 수
 * @param matched          detail과 일치한 조인 레코드 수
 * @param detailDuplicates detail에서 같은 식별자가 다시 나온 횟수
 */
public record JoinResult(
        List<NormalizedRecord> combined,
        int droppedRoster,
        int matched,
        int detailDuplicates
) {
    public JoinResult {
        combined = List.copyOf(combined);
    }

    public int unmatched() {
        return combined.size() - matched;
    }
}
