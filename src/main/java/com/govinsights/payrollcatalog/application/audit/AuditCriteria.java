package com.govinsights.payrollcatalog.application.audit;

import java.util.List;

/**
 * 품질 점검 기준.
 *
 * @param requiredFields   null/공백 개수를 셀 필드
 * @param groupingField    그룹 카디널리티를 볼 필드
 * @param uniquenessFields 조합 유일성을 확인할 필드
 * @param rangeFields      min/max를 계산할 숫자 필드
 * @param topGroupLimit    보고할 상위 그룹 수
 */
public record AuditCriteria(
        List<String> requiredFields,
        String groupingField,
        List<String> uniquenessFields,
        List<String> rangeFields,
        int topGroupLimit
) {
    public AuditCriteria {
        requiredFields = List.copyOf(requiredFields);
        uniquenessFields = List.copyOf(uniquenessFields);
        rangeFields = rangeFields == null ? List.of() : List.copyOf(rangeFields);
        if (topGroupLimit < 0) throw new IllegalArgumentException("topGroupLimit must be >= 0");
    }
}
