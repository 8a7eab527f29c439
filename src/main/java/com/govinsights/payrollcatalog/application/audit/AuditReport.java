package com.govinsights.payrollcatalog.application.audit;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * 레코드 집합의 품질 점검 결과.
 *
 * @param recordCount         점검한 레코드 수
 * @param nullCounts          필수 필드별 null/공백 수(기준 순서 유지)
 * @param groupingField       그룹 필드
 * @param groupCardinality    그룹 필드의 서로 다른 값 수(null 제외)
 * @param topGroups           레코드 수 기준 상위 그룹
 * @param uniquenessFields    유일성 확인 필드
 * @param unique              유일성 필드 조합이 전체에서 유일한지 여부
 * @param duplicates          중복된 조합과 등장 횟수(처음 나온 순서)
 * @param ranges              숫자 필드별 범위
 */
public record AuditReport(
        int recordCount,
        Map<String, Long> nullCounts,
        String groupingField,
        long groupCardinality,
        List<GroupCount> topGroups,
        List<String> uniquenessFields,
        boolean unique,
        List<DuplicateKey> duplicates,
        Map<String, NumericRange> ranges
) {

    /** 그룹 값과 레코드 수 */
    public record GroupCount(String value, long count) {}

    /** 중복된 필드 조합(null 포함 가능)과 등장 횟수 */
    public record DuplicateKey(List<Object> values, long count) {}

    /**
     * 숫자 필드 범위. 숫자 값이 하나도 없으면 min/max는 null.
     *
     * @param min   최솟값
     * @param max   최댓값
     * @param count 숫자 값이 있는 레코드 수
     */
    public record NumericRange(BigDecimal min, BigDecimal max, long count) {}
}
